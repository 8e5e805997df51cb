package com.di.adbatch.runner;

import com.di.adbatch.checkpoint.CheckpointStore;
import lombok.Builder;
import lombok.Value;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line options of one invocation.
 *
 * <pre>
 *   --input=&lt;file&gt;          campaign table (JSON); required unless listing
 *   --resume=&lt;sessionId&gt;    continue the given session
 *   --retry-failed           also re-run tasks the checkpoint records as FAILED
 *   --fresh                  discard the resumed session's checkpoint first
 *   --workers=&lt;n&gt;           parallel workers (default adbatch.workers)
 *   --dry-run                expand and print the plan, no remote calls
 *   --list-checkpoints       list stored sessions and exit
 * </pre>
 */
@Value
@Builder
public class BatchRunOptions {

    static final Set<String> KNOWN = Set.of(
            "input", "resume", "retry-failed", "fresh", "workers", "dry-run", "list-checkpoints");

    Path    input;
    String  resumeSessionId;
    boolean retryFailed;
    boolean fresh;
    /** Absent when not given on the command line. */
    Integer workers;
    boolean dryRun;
    boolean listCheckpoints;

    public Optional<String> getResume() {
        return Optional.ofNullable(resumeSessionId);
    }

    public Optional<Integer> getWorkerOverride() {
        return Optional.ofNullable(workers);
    }

    /**
     * @throws IllegalArgumentException for unknown options, missing or malformed values
     */
    public static BatchRunOptions from(ApplicationArguments args) {
        for (String name : args.getOptionNames()) {
            if (!KNOWN.contains(name)) {
                throw new IllegalArgumentException("Unknown option --" + name);
            }
        }
        if (!args.getNonOptionArgs().isEmpty()) {
            throw new IllegalArgumentException("Unexpected argument(s) " + args.getNonOptionArgs()
                    + "; use --input=<file>");
        }

        boolean list  = args.containsOption("list-checkpoints");
        String  input = single(args, "input");
        if (input == null && !list) {
            throw new IllegalArgumentException("--input=<file> is required");
        }

        String  workersRaw = single(args, "workers");
        Integer workers    = null;
        if (args.containsOption("workers") && workersRaw == null) {
            throw new IllegalArgumentException("--workers needs a value: --workers=<n>");
        }
        if (workersRaw != null) {
            try {
                workers = Integer.parseInt(workersRaw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--workers must be a number, got '" + workersRaw + "'");
            }
            if (workers < 1) {
                throw new IllegalArgumentException("--workers must be at least 1, got " + workers);
            }
        }

        String resume = single(args, "resume");
        if (args.containsOption("resume") && (resume == null || resume.isBlank())) {
            throw new IllegalArgumentException("--resume needs a session id: --resume=<sessionId>");
        }
        if (resume != null && !CheckpointStore.isValidSessionId(resume)) {
            throw new IllegalArgumentException("--resume: invalid session id '" + resume
                    + "', use letters, digits, '.', '_' or '-'");
        }
        if (resume != null && resume.matches(".+" + CheckpointStore.SHARD_MARKER + "\\d+")) {
            throw new IllegalArgumentException("--resume takes the session id, not a worker shard: '" + resume + "'");
        }

        return BatchRunOptions.builder()
                .input(input == null ? null : Path.of(input))
                .resumeSessionId(resume)
                .retryFailed(args.containsOption("retry-failed"))
                .fresh(args.containsOption("fresh"))
                .workers(workers)
                .dryRun(args.containsOption("dry-run"))
                .listCheckpoints(list)
                .build();
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return values.get(0);
    }
}
