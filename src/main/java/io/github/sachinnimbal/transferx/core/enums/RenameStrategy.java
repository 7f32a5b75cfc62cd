package io.github.sachinnimbal.transferx.core.enums;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Built-in serialization name strategies. Field names are split into words on
 * underscores and on lower-to-upper case humps, so both {@code first_name} and
 * {@code firstName} become {@code first-name} under {@link #KEBAB}.
 */
public enum RenameStrategy implements UnaryOperator<String> {
    /** Keeps the field name. Same as leaving the strategy unset. */
    NONE {
        @Override
        public String apply(String name) {
            return name;
        }
    },
    UPPER {
        @Override
        public String apply(String name) {
            return name.toUpperCase(Locale.ROOT);
        }
    },
    LOWER {
        @Override
        public String apply(String name) {
            return name.toLowerCase(Locale.ROOT);
        }
    },
    CAMEL {
        @Override
        public String apply(String name) {
            return camelize(name, false);
        }
    },
    PASCAL {
        @Override
        public String apply(String name) {
            return camelize(name, true);
        }
    },
    KEBAB {
        @Override
        public String apply(String name) {
            return String.join("-", words(name)).toLowerCase(Locale.ROOT);
        }
    };

    public static String camelize(String name, boolean capitalizeFirst) {
        StringBuilder sb = new StringBuilder(name.length());
        List<String> words = words(name);
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i).toLowerCase(Locale.ROOT);
            if (i == 0 && !capitalizeFirst) {
                sb.append(word);
            } else if (!word.isEmpty()) {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return sb.toString();
    }

    static List<String> words(String name) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_' || c == '-') {
                flush(words, current);
                continue;
            }
            if (Character.isUpperCase(c) && current.length() > 0
                    && Character.isLowerCase(current.charAt(current.length() - 1))) {
                flush(words, current);
            }
            current.append(c);
        }
        flush(words, current);
        return words;
    }

    private static void flush(List<String> words, StringBuilder current) {
        if (current.length() > 0) {
            words.add(current.toString());
            current.setLength(0);
        }
    }
}
