package com.cppformatter.plugins.cpp.lexer;

import java.util.Set;

/**
 * Reserved words of C and C++, grouped by the roles the formatter cares about.
 */
public final class Keywords {

    public static final Set<String> ALL = Set.of(
            "alignas", "alignof", "and", "and_eq", "asm", "auto", "bitand", "bitor", "bool", "break",
            "case", "catch", "char", "char8_t", "char16_t", "char32_t", "class", "compl", "concept",
            "const", "consteval", "constexpr", "constinit", "const_cast", "continue", "co_await",
            "co_return", "co_yield", "decltype", "default", "delete", "do", "double", "dynamic_cast",
            "else", "enum", "explicit", "export", "extern", "false", "float", "for", "friend", "goto",
            "if", "inline", "int", "long", "mutable", "namespace", "new", "noexcept", "not", "not_eq",
            "nullptr", "operator", "or", "or_eq", "private", "protected", "public", "register",
            "reinterpret_cast", "requires", "restrict", "return", "short", "signed", "sizeof", "static",
            "static_assert", "static_cast", "struct", "switch", "template", "this", "thread_local",
            "throw", "true", "try", "typedef", "typeid", "typename", "union", "unsigned", "using",
            "virtual", "void", "volatile", "wchar_t", "while", "xor", "xor_eq",
            "_Alignas", "_Alignof", "_Atomic", "_Bool", "_Complex", "_Generic", "_Imaginary",
            "_Noreturn", "_Static_assert", "_Thread_local");

    /** Keywords followed by a parenthesized condition. */
    public static final Set<String> CONTROL_WITH_CONDITION = Set.of("if", "for", "while", "switch", "catch");

    /** Keywords that name a built-in type or stand in for one. */
    public static final Set<String> BUILTIN_TYPES = Set.of(
            "auto", "bool", "char", "char8_t", "char16_t", "char32_t", "double", "float", "int", "long",
            "short", "signed", "unsigned", "void", "wchar_t", "_Bool", "_Complex");

    /** Type qualifiers that may sit between a type and its declarator. */
    public static final Set<String> QUALIFIERS = Set.of("const", "volatile", "restrict", "_Atomic");

    /** Keywords that may precede a type at the start of a declaration. */
    public static final Set<String> DECLARATION_SPECIFIERS = Set.of(
            "static", "const", "constexpr", "consteval", "constinit", "extern", "inline", "virtual",
            "mutable", "friend", "typename", "struct", "class", "union", "enum", "register",
            "thread_local", "explicit", "typedef", "volatile", "_Thread_local", "_Noreturn");

    /** Keywords that evaluate to a value and therefore end an operand. */
    public static final Set<String> VALUE_KEYWORDS = Set.of("this", "true", "false", "nullptr");

    /** Keywords that introduce a class-like body. */
    public static final Set<String> TYPE_HEADS = Set.of("class", "struct", "union", "enum");

    private Keywords() {
    }

    public static boolean isKeyword(String word) {
        return ALL.contains(word);
    }
}
