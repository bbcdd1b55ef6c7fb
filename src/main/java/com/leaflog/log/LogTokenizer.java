package com.leaflog.log;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies raw log lines into typed tokens so downstream stages never
 * re-parse text.
 *
 * Recognized grammar:
 *   "Program <base58 id> invoke [<depth>]"   → INVOKE
 *   "Program <base58 id> success"            → SUCCESS
 *   "Program log: Instruction: <Name>"       → INSTRUCTION
 *   "Program data: <base64>"                 → DATA (trailing payload is kept)
 *   "Log truncated..."                       → TRUNCATED
 *   anything else                            → PLAIN
 *
 * Example:
 *   "Program GRoLL... invoke [2]" → INVOKE(programId="GRoLL...", depth=2)
 */
@Component
public class LogTokenizer {

    static final String TRUNCATION_MARKER = "Log truncated";

    private static final String BASE58 = "[1-9A-HJ-NP-Za-km-z]+";

    private static final Pattern INVOKE =
            Pattern.compile("^Program (" + BASE58 + ") invoke \\[(\\d+)\\]$");
    private static final Pattern SUCCESS =
            Pattern.compile("^Program (" + BASE58 + ") success$");
    private static final Pattern INSTRUCTION =
            Pattern.compile("^Program log: Instruction: (.+)$");
    private static final Pattern DATA =
            Pattern.compile("^Program data: (?:.* )?([A-Za-z0-9+/]+={0,2})$");

    public LogToken tokenize(String line) {
        if (line == null) {
            return LogToken.plain("");
        }
        if (line.startsWith(TRUNCATION_MARKER)) {
            return LogToken.truncated(line);
        }

        Matcher m = INVOKE.matcher(line);
        if (m.matches()) {
            return LogToken.invoke(line, m.group(1), Integer.parseInt(m.group(2)));
        }
        m = SUCCESS.matcher(line);
        if (m.matches()) {
            return LogToken.success(line, m.group(1));
        }
        m = INSTRUCTION.matcher(line);
        if (m.matches()) {
            return LogToken.instruction(line, m.group(1).trim());
        }
        m = DATA.matcher(line);
        if (m.matches()) {
            return LogToken.data(line, m.group(1));
        }
        return LogToken.plain(line);
    }

    public List<LogToken> tokenizeAll(List<String> lines) {
        List<LogToken> tokens = new ArrayList<>(lines.size());
        for (String line : lines) {
            tokens.add(tokenize(line));
        }
        return tokens;
    }

    /**
     * True if any line carries the truncation marker. Checked before the
     * structural parse is trusted.
     */
    public static boolean isTruncated(List<LogToken> tokens) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).is(LogToken.Type.TRUNCATED)) {
                return true;
            }
        }
        return false;
    }
}
