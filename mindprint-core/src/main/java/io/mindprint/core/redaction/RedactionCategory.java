package io.mindprint.core.redaction;

public enum RedactionCategory {
    NAME("[NAME]"),
    EMAIL("[EMAIL]"),
    PHONE("[PHONE]"),
    URL("[URL]"),
    IP_ADDRESS("[IP_ADDRESS]"),
    API_KEY("[API_KEY]"),
    CUSTOMER_ID("[CUSTOMER_ID]"),
    ADDRESS("[ADDRESS]"),
    DATE("[DATE]"),
    OTHER("[REDACTED]");

    private final String placeholder;

    RedactionCategory(String placeholder) {
        this.placeholder = placeholder;
    }

    public String placeholder() {
        return placeholder;
    }
}
