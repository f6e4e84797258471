package com.playfactory.provisioning;

import com.playfactory.core.error.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates a provisioning request before anything is reserved or built.
 *
 * <p>Besides the size and metadata limits, user code is scanned for constructs that give a
 * game module host access (file system, child processes, dynamic evaluation). Only those
 * patterns reject a request; the container sandbox is still the real boundary.
 */
public class UserCodeInspector {

    private static final Logger log = LoggerFactory.getLogger(UserCodeInspector.class);

    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final List<Rule> BLOCKED = List.of(
            new Rule(Pattern.compile("require\\s*\\(\\s*['\"]fs['\"]"), "file system access"),
            new Rule(Pattern.compile("require\\s*\\(\\s*['\"]child_process['\"]"), "child process execution"),
            new Rule(Pattern.compile("\\beval\\s*\\("), "eval()"),
            new Rule(Pattern.compile("(?<!\\w)Function\\s*\\("), "Function constructor")
    );

    private final int maxCodeSizeBytes;
    private final boolean securityScanEnabled;

    public UserCodeInspector(int maxCodeSizeBytes, boolean securityScanEnabled) {
        this.maxCodeSizeBytes = maxCodeSizeBytes;
        this.securityScanEnabled = securityScanEnabled;
    }

    /**
     * @throws InvalidInputException describing the first problem found
     */
    public void validate(String userCode, String name, String description) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Server name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidInputException("Server name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidInputException("Description exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (userCode == null || userCode.isBlank()) {
            throw new InvalidInputException("User code is empty");
        }
        int size = userCode.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxCodeSizeBytes) {
            throw new InvalidInputException("User code is " + size + " bytes; limit is " + maxCodeSizeBytes);
        }
        if (securityScanEnabled) {
            List<String> findings = scan(userCode);
            if (!findings.isEmpty()) {
                log.warn("Rejected code for '{}': {}", name, findings);
                throw new InvalidInputException("User code uses forbidden constructs: " + String.join(", ", findings));
            }
        }
    }

    /**
     * Returns a finding per blocked construct, with the 1-based line it first appears on.
     */
    List<String> scan(String userCode) {
        var findings = new ArrayList<String>();
        String[] lines = userCode.split("\n", -1);
        for (Rule rule : BLOCKED) {
            for (int i = 0; i < lines.length; i++) {
                if (rule.pattern().matcher(lines[i]).find()) {
                    findings.add(rule.description() + " (line " + (i + 1) + ")");
                    break;
                }
            }
        }
        return findings;
    }

    private record Rule(Pattern pattern, String description) {}
}
