package io.practicedb.core.validation;

public record RuleResult(boolean valid, String error) {
    private static final RuleResult OK = new RuleResult(true, null);

    public static RuleResult ok() {
        return OK;
    }

    public static RuleResult fail(String error) {
        return new RuleResult(false, error);
    }
}
