package com.svdac.model;

/**
 * 语句所处的条件上下文（if 条件或 case 选择表达式）
 */
public record ConditionTag(Kind kind, String expression) {

    public static ConditionTag ifTag(String condition) {
        return new ConditionTag(Kind.IF, condition);
    }

    public static ConditionTag caseTag(String selector) {
        return new ConditionTag(Kind.CASE, selector);
    }

    /** 追加到语句末尾的标注，例如 " :if: (valid)" */
    public String render() {
        return " " + kind.marker() + " " + expression;
    }

    public enum Kind {
        IF(":if:"), CASE(":case:");

        private final String marker;

        Kind(String marker) {
            this.marker = marker;
        }

        public String marker() {
            return marker;
        }

        public static boolean isMarker(String text) {
            for (Kind kind : values()) {
                if (kind.marker.equals(text)) {
                    return true;
                }
            }
            return false;
        }
    }
}
