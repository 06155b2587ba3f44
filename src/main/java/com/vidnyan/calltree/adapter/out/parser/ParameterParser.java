package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.Parameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the text between a function's parentheses into parameter descriptors.
 * Handles AUTOSAR wrappers (VAR, P2VAR, P2CONST, CONST and their CONSTP2 forms),
 * plain C declarations, arrays and function pointers.
 */
final class ParameterParser {

    private ParameterParser() {
    }

    static List<Parameter> parse(String raw) {
        String trimmed = raw == null ? "" : raw.strip();
        if (trimmed.isEmpty() || trimmed.equals("void")) {
            return List.of();
        }
        List<Parameter> parameters = new ArrayList<>();
        for (String part : splitTopLevel(trimmed)) {
            String param = part.strip();
            if (param.isEmpty() || param.equals("void")) {
                continue;
            }
            Parameter parsed = parseWrapped(param);
            parameters.add(parsed != null ? parsed : parsePlain(param));
        }
        return parameters;
    }

    /**
     * Split on commas that are not nested in (), [] or {}.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static Parameter parseWrapped(String param) {
        int open = param.indexOf('(');
        if (open <= 0) {
            return null;
        }
        String macro = param.substring(0, open).strip();
        int close = matchingParen(param, open);
        if (close < 0) {
            return null;
        }
        List<String> args = splitTopLevel(param.substring(open + 1, close)).stream()
                .map(String::strip)
                .toList();
        String rest = param.substring(close + 1).strip();

        switch (macro) {
            case "VAR" -> {
                return args.size() == 2 ? wrapped(rest, args.get(0), false, false, Parameter.Wrapper.VAR, args.get(1)) : null;
            }
            case "CONST" -> {
                return args.size() == 2 ? wrapped(rest, args.get(0), false, true, Parameter.Wrapper.CONST, args.get(1)) : null;
            }
            case "P2VAR", "CONSTP2VAR" -> {
                return args.size() == 3 ? wrapped(rest, args.get(0), true, false, Parameter.Wrapper.P2VAR, args.get(2)) : null;
            }
            case "P2CONST", "CONSTP2CONST" -> {
                return args.size() == 3 ? wrapped(rest, args.get(0), true, true, Parameter.Wrapper.P2CONST, args.get(2)) : null;
            }
            case "P2FUNC", "CONSTP2FUNC" -> {
                // P2FUNC(rettype, ptrclass, name)(args)
                if (args.size() != 3) {
                    return null;
                }
                String signature = args.get(0) + " (*)" + rest;
                return Parameter.plain(args.get(2), signature, true, false);
            }
            default -> {
                return null;
            }
        }
    }

    private static Parameter wrapped(String rest, String type, boolean pointer, boolean constant,
                                     Parameter.Wrapper wrapper, String memoryClass) {
        if (rest.startsWith("(")) {
            // VAR(rettype, memclass) (*name)(args)
            String inner = rest.substring(1).strip();
            if (inner.startsWith("*")) {
                String name = leadingIdentifier(inner.substring(1).strip());
                int close = ParameterParser.matchingParen(rest, 0);
                String signature = type + " (*)" + (close >= 0 ? rest.substring(close + 1).strip() : "");
                return new Parameter(name, signature, true, constant, wrapper, memoryClass);
            }
        }
        String name = leadingIdentifier(rest);
        boolean array = rest.indexOf('[') >= 0;
        return new Parameter(name, type, pointer || array, constant, wrapper, memoryClass);
    }

    private static Parameter parsePlain(String param) {
        String decl = param;

        // function pointer: rettype (*name)(args)
        int star = decl.indexOf("(*");
        if (star >= 0) {
            int close = decl.indexOf(')', star);
            if (close > star) {
                String name = decl.substring(star + 2, close).strip();
                String type = (decl.substring(0, star).strip() + " (*)" + decl.substring(close + 1).strip()).strip();
                return Parameter.plain(name, type, true, false);
            }
        }

        boolean array = false;
        int bracket = decl.indexOf('[');
        if (bracket >= 0) {
            array = true;
            decl = decl.substring(0, bracket);
        }

        boolean pointer = decl.indexOf('*') >= 0 || array;
        decl = decl.replace('*', ' ');

        boolean constant = false;
        List<String> tokens = new ArrayList<>();
        for (String token : decl.strip().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.equals("const")) {
                constant = true;
            } else {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty()) {
            return Parameter.plain("", "", pointer, constant);
        }
        if (tokens.size() == 1) {
            // unnamed parameter, e.g. "uint8"
            return Parameter.plain("", tokens.get(0), pointer, constant);
        }
        String name = tokens.get(tokens.size() - 1);
        String type = String.join(" ", tokens.subList(0, tokens.size() - 1));
        return Parameter.plain(name, type, pointer, constant);
    }

    private static String leadingIdentifier(String text) {
        int i = 0;
        while (i < text.length() && CKeywords.isIdentifierPart(text.charAt(i))) {
            i++;
        }
        return text.substring(0, i);
    }

    static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
