package com.mainframe.fixedwidth.layout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.fixedwidth.exception.LayoutParseException;

/**
 * Parser for layout files.
 *
 * Format:
 * - Definition defaults: options align=left padding=' '
 * - Schema block: schema NAME [key=value ...] ... end
 * - Column: column NAME LENGTH [key=value ...]
 * - Filler: spacer LENGTH [PAD]
 * - Reference: ref STORE [SCHEMA] [key=value ...]
 * - Comments: # comment
 *
 * Only builds statements; declaring schemas from them is {@link LayoutDocument#toDefinition}.
 */
public class LayoutParser {
    private static final Logger log = LoggerFactory.getLogger(LayoutParser.class);

    static final String OPTIONS = "options";
    static final String SCHEMA = "schema";
    static final String END = "end";
    static final String COLUMN = "column";
    static final String SPACER = "spacer";
    static final String REF = "ref";

    private static final Set<String> KEYWORDS = Set.of(OPTIONS, SCHEMA, END, COLUMN, SPACER, REF);

    private final LayoutTokenizer tokenizer = new LayoutTokenizer();

    public LayoutDocument parse(Path layoutFile) throws IOException {
        log.info("Reading layout: {}", layoutFile);
        return parse(Files.readAllLines(layoutFile, StandardCharsets.UTF_8));
    }

    public LayoutDocument parse(List<String> lines) {
        Map<String, String> definitionOptions = new LinkedHashMap<>();
        List<LayoutStatement> schemas = new ArrayList<>();
        Deque<LayoutStatement> open = new ArrayDeque<>();
        int optionsLine = 0;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            List<String> words = tokenizer.tokenize(line, lineNum);
            if (words.isEmpty()) {
                continue;
            }

            LayoutStatement statement = toStatement(words, lineNum);
            switch (statement.getKeyword()) {
            case OPTIONS -> {
                if (!open.isEmpty()) {
                    throw new LayoutParseException(lineNum, "'options' is only allowed outside schema blocks");
                }
                requireArguments(statement, 0, 0);
                definitionOptions.putAll(statement.getOptions());
                optionsLine = lineNum;
            }
            case SCHEMA -> {
                requireArguments(statement, 1, 1);
                if (open.isEmpty()) {
                    schemas.add(statement);
                } else {
                    open.peek().addChild(statement);
                }
                open.push(statement);
            }
            case END -> {
                requireArguments(statement, 0, 0);
                if (open.isEmpty()) {
                    throw new LayoutParseException(lineNum, "'end' without an open schema");
                }
                open.pop();
            }
            default -> {
                if (open.isEmpty()) {
                    throw new LayoutParseException(lineNum, "'" + statement.getKeyword() + "' must be inside a schema block");
                }
                validateField(statement);
                open.peek().addChild(statement);
            }
            }
            log.debug("Parsed layout statement {} at line {}", statement.getKeyword(), lineNum);
        }

        if (!open.isEmpty()) {
            LayoutStatement unclosed = open.peek();
            throw new LayoutParseException(unclosed.getLine(),
                    "Schema '" + unclosed.argument(0) + "' is never closed with 'end'");
        }
        return new LayoutDocument(definitionOptions, optionsLine, schemas);
    }

    private LayoutStatement toStatement(List<String> words, int lineNum) {
        String keyword = words.get(0).toLowerCase(Locale.ROOT);
        if (!KEYWORDS.contains(keyword)) {
            throw new LayoutParseException(lineNum, "Unknown keyword '" + words.get(0) + "'");
        }

        List<String> arguments = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        for (String word : words.subList(1, words.size())) {
            int eq = word.indexOf('=');
            if (eq > 0) {
                String key = word.substring(0, eq);
                if (options.put(key, word.substring(eq + 1)) != null) {
                    throw new LayoutParseException(lineNum, "Option '" + key + "' given twice");
                }
            } else if (eq == 0) {
                throw new LayoutParseException(lineNum, "Option without a name: '" + word + "'");
            } else {
                arguments.add(word);
            }
        }
        return new LayoutStatement(lineNum, keyword, arguments, options);
    }

    private void validateField(LayoutStatement statement) {
        switch (statement.getKeyword()) {
        case COLUMN -> requireArguments(statement, 2, 2);
        case SPACER -> {
            requireArguments(statement, 1, 2);
            if (!statement.getOptions().isEmpty()) {
                throw new LayoutParseException(statement.getLine(), "'spacer' takes no options");
            }
        }
        case REF -> requireArguments(statement, 1, 2);
        default -> throw new LayoutParseException(statement.getLine(), "Unexpected '" + statement.getKeyword() + "'");
        }
    }

    private void requireArguments(LayoutStatement statement, int min, int max) {
        int count = statement.getArguments().size();
        if (count < min || count > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new LayoutParseException(statement.getLine(), "'" + statement.getKeyword() + "' expects "
                    + expected + " argument(s), got " + count);
        }
    }
}
