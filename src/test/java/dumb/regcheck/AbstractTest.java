package dumb.regcheck;

import dumb.regcheck.util.Log;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static dumb.regcheck.Term.constant;
import static dumb.regcheck.Term.var;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    protected static final TypeEnvironment ENV = TypeEnvironment.builder()
            .predicate("coveredEntity", Type.ENTITY)
            .predicate("disclose", Type.ENTITY, Type.ENTITY, Type.ENTITY)
            .predicate("hasConsent", Type.ENTITY, Type.ENTITY)
            .predicate("Person", Type.ENTITY)
            .predicate("trained", Type.ENTITY)
            .predicate("P", Type.ENTITY)
            .predicate("Q", Type.ENTITY)
            .predicate("raining")
            .function("age", Type.INT, Type.ENTITY)
            .function("name", Type.STRING, Type.ENTITY)
            .constant("hospital", Type.ENTITY)
            .constant("alice", Type.ENTITY)
            .constant("bob", Type.ENTITY)
            .constant("phi", Type.ENTITY)
            .constant("adult", Type.INT)
            .build();

    protected final List<Log.Entry> logged = new ArrayList<>();

    @BeforeEach
    void captureLog() {
        Log.setListener(logged::add);
    }

    @AfterEach
    void releaseLog() {
        Log.setListener(null);
    }

    protected static Formula formula(String src) {
        try {
            return Parser.parseFormula(src);
        } catch (ParseException e) {
            return fail("Failed to parse formula:\n" + src + "\n" + e.getMessage());
        }
    }

    protected static PolicyFile policyFile(String src) {
        try {
            return Parser.parse(src);
        } catch (ParseException e) {
            return fail("Failed to parse policy file:\n" + src + "\n" + e.getMessage());
        }
    }

    protected static Path resource(String name) {
        try {
            return Path.of(Objects.requireNonNull(AbstractTest.class.getResource("/" + name), name).toURI());
        } catch (URISyntaxException e) {
            return fail(e);
        }
    }

    protected static Formula.Predicate p(String name, Term... args) {
        return Formula.pred(name, args);
    }

    protected static Term x() {
        return var("x");
    }

    protected static Term at(String name) {
        return constant(name);
    }

    protected long warnings() {
        return logged.stream().filter(e -> e.level() == Log.LogLevel.WARNING).count();
    }
}
