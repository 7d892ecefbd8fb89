package com.jiracdc.git;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GitConfig {

    @Bean
    public IssueMarkdownFormatter issueMarkdownFormatter() {
        return new IssueMarkdownFormatter();
    }

    @Bean
    public GitWriter gitWriter(GitProperties properties, IssueMarkdownFormatter formatter, Clock clock) {
        return new GitCliWriter(properties, formatter, clock);
    }
}
