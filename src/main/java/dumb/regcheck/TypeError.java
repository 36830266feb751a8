package dumb.regcheck;

/**
 * Semantic errors reported by the {@link TypeChecker}. Values, not exceptions: they are collected and returned.
 */
sealed public interface TypeError {

    String message();

    record UnknownVar(String name) implements TypeError {
        @Override
        public String message() {
            return "Unknown variable " + name;
        }
    }

    record UnknownPredicate(String name) implements TypeError {
        @Override
        public String message() {
            return "Unknown predicate: " + name;
        }
    }

    record UnknownFunction(String name) implements TypeError {
        @Override
        public String message() {
            return "Unknown function: " + name;
        }
    }

    record UnknownConst(String name) implements TypeError {
        @Override
        public String message() {
            return "Unknown constant: " + name;
        }
    }

    record ArityMismatch(String name, int expected, int got) implements TypeError {
        @Override
        public String message() {
            return name + " expects " + expected + " arguments, got " + got;
        }
    }

    record TypeMismatch(Type expected, Type got) implements TypeError {
        @Override
        public String message() {
            return "Type mismatch: expected " + expected + ", got " + got;
        }
    }

    /** {@code position} is 0-based. */
    record InvalidArgumentType(int position, Type expected, Type got) implements TypeError {
        @Override
        public String message() {
            return "Argument " + position + ": expected " + expected + ", got " + got;
        }
    }

    record UnboundVariable(String name) implements TypeError {
        @Override
        public String message() {
            return "Unbound variable: " + name;
        }
    }

    record InvalidTemporalBound(String detail) implements TypeError {
        @Override
        public String message() {
            return "Invalid temporal bound: " + detail;
        }
    }

    record InvalidQuantifierBinding(String detail) implements TypeError {
        @Override
        public String message() {
            return "Invalid quantifier binding: " + detail;
        }
    }
}
