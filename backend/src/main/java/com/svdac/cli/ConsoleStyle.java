package com.svdac.cli;

import java.util.Map;

/**
 * 终端颜色，TERM 中包含 "color" 时启用
 */
public record ConsoleStyle(String red, String yellow, String underlineYellow, String reset) {

    public static ConsoleStyle plain() {
        return new ConsoleStyle("", "", "", "");
    }

    public static ConsoleStyle ansi() {
        return new ConsoleStyle("\033[91m", "\033[93m", "\033[93m\033[4m", "\033[0m");
    }

    public static ConsoleStyle fromEnvironment(Map<String, String> env) {
        String term = env.get("TERM");
        return term != null && term.contains("color") ? ansi() : plain();
    }
}
