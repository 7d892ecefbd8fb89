package com.jiracdc.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads credentials from a mounted secret directory containing {@code username} and
 * {@code token} files, falling back to the values configured under {@code jiracdc.jira}.
 * Reading on every {@link #resolve()} call picks up rotated secrets.
 */
public class SecretDirectoryCredentialsProvider implements CredentialsProvider {

    private static final Logger log = LoggerFactory.getLogger(SecretDirectoryCredentialsProvider.class);

    private final JiraProperties properties;

    public SecretDirectoryCredentialsProvider(JiraProperties properties) {
        this.properties = properties;
    }

    @Override
    public JiraCredentials resolve() {
        String dir = properties.getCredentialsDir();
        if (dir != null && !dir.isBlank()) {
            Path base = Path.of(dir);
            Path usernameFile = base.resolve("username");
            Path tokenFile = base.resolve("token");
            if (Files.isReadable(usernameFile) && Files.isReadable(tokenFile)) {
                try {
                    var username = Files.readString(usernameFile, StandardCharsets.UTF_8).trim();
                    var token = Files.readString(tokenFile, StandardCharsets.UTF_8).trim();
                    if (!username.isEmpty() && !token.isEmpty()) {
                        log.debug("Resolved Jira credentials from {}", base);
                        return new JiraCredentials(username, token);
                    }
                    log.warn("Credential files in {} are empty, falling back to configuration", base);
                } catch (IOException e) {
                    throw new CredentialsException("Failed to read Jira credentials from " + base, e);
                }
            } else {
                log.warn("Credentials directory {} has no readable username/token files", base);
            }
        }

        var username = properties.getUsername();
        var token = properties.getToken();
        if (username == null || username.isBlank() || token == null || token.isBlank()) {
            throw new CredentialsException(
                    "Jira credentials not configured. Set JIRACDC_JIRA_USERNAME and JIRACDC_JIRA_TOKEN "
                            + "or mount a secret at jiracdc.jira.credentials-dir.");
        }
        return new JiraCredentials(username, token);
    }
}
