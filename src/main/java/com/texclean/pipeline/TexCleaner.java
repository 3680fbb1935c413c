package com.texclean.pipeline;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.texclean.conditional.ConditionalDiagnostic;
import com.texclean.conditional.ConditionalSimplifier;
import com.texclean.conditional.SimplificationResult;
import com.texclean.text.CommandStripper;
import com.texclean.text.CommentStripper;
import com.texclean.text.EnvironmentStripper;

/**
 * The per-file stages: comments, comment environments, static conditionals, configured environments,
 * commands whose text is kept, then commands removed with their text.
 */
public class TexCleaner {
    private static final Logger log = LoggerFactory.getLogger(TexCleaner.class);

    private final CommentStripper commentStripper;
    private final EnvironmentStripper environmentStripper = new EnvironmentStripper();
    private final ConditionalSimplifier conditionalSimplifier;
    private final CommandStripper commandStripper = new CommandStripper();
    private final Rules rules;

    public TexCleaner(Rules rules) {
        this.rules = rules;
        this.commentStripper = new CommentStripper(rules.commentProtectedCommands());
        this.conditionalSimplifier = new ConditionalSimplifier(rules.ifExceptions());
    }

    public Optional<ConditionalDiagnostic> clean(SourceFile file) {
        log.info("Removing comments in file {}.", file.path());
        String content = commentStripper.strip(file.body());
        content = environmentStripper.strip(content, EnvironmentStripper.COMMENT_ENVIRONMENT);

        SimplificationResult simplified = conditionalSimplifier.simplify(content);
        simplified.diagnostic().ifPresent(diagnostic ->
                log.warn("Conditionals in {} left as is: {}", file.path(), diagnostic.message()));
        content = simplified.text();

        for (String environment : rules.environmentsToDelete()) {
            content = environmentStripper.strip(content, environment);
        }
        for (String command : rules.commandsOnlyToDelete()) {
            content = commandStripper.unwrap(content, command);
        }
        for (String command : rules.commandsToDelete()) {
            content = commandStripper.delete(content, command);
        }
        file.replaceBody(content);
        return simplified.diagnostic();
    }

    public record Rules(
            List<String> commandsToDelete,
            List<String> commandsOnlyToDelete,
            List<String> environmentsToDelete,
            List<String> ifExceptions,
            List<String> commentProtectedCommands) {

        public Rules {
            commandsToDelete = List.copyOf(commandsToDelete);
            commandsOnlyToDelete = List.copyOf(commandsOnlyToDelete);
            environmentsToDelete = List.copyOf(environmentsToDelete);
            ifExceptions = List.copyOf(ifExceptions);
            commentProtectedCommands = List.copyOf(commentProtectedCommands);
        }

        public static Rules none() {
            return new Rules(List.of(), List.of(), List.of(), List.of(), CommentStripper.DEFAULT_PROTECTED_COMMANDS);
        }
    }
}
