package edu.kit.kastel.vads.flowchart.lexer;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum KeywordType {
    VAR("var"),
    INTEGER("integer"),
    REAL("real"),
    BOOLEAN("boolean"),
    BEGIN("begin"),
    END("end"),
    IF("if"),
    THEN("then"),
    ELSE("else"),
    WHILE("while"),
    DO("do"),
    FOR("for"),
    TO("to"),
    DOWNTO("downto"),
    REPEAT("repeat"),
    UNTIL("until"),
    WRITELN("writeln"),
    WRITE("write"),
    READLN("readln"),
    READ("read");

    private static final Map<String, KeywordType> BY_KEYWORD = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(KeywordType::keyword, Function.identity()));

    private final String keyword;

    KeywordType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /// Looks up a keyword ignoring case.
    public static Optional<KeywordType> fromString(String word) {
        return Optional.ofNullable(BY_KEYWORD.get(word.toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return keyword();
    }
}
