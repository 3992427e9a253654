package org.stianloader.picopip.vcs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.VcsType;
import org.stianloader.picopip.logging.LoggingAdapter;
import org.stianloader.picopip.vcs.VcsException.Reason;

/**
 * A {@link VcsGateway} that runs the command line client of the VCS, which must be on the PATH
 * unless another executable is configured through {@link #setExecutable(String)}.
 */
public abstract class CommandLineVcsGateway extends AbstractVcsGateway {

    @NotNull
    private volatile String executable;

    protected CommandLineVcsGateway(@NotNull VcsType type, @NotNull String defaultExecutable) {
        super(type);
        this.executable = defaultExecutable;
    }

    /**
     * Creates the parent directories of a checkout that is about to be obtained.
     *
     * @param targetDirectory The checkout directory
     * @throws VcsException If the directory already exists or its parent cannot be created
     */
    protected static void prepareTarget(@NotNull Path targetDirectory) throws VcsException {
        if (Files.exists(targetDirectory)) {
            throw new VcsException(Reason.CORRUPT, "Target directory " + targetDirectory + " already exists");
        }
        Path parent = targetDirectory.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new VcsException(Reason.CORRUPT, "Unable to create " + parent, e);
        }
    }

    @NotNull
    public String getExecutable() {
        return this.executable;
    }

    /**
     * Runs the VCS client and returns its combined standard output and error stream.
     *
     * @param workingDirectory The directory to run the client in
     * @param failureReason The reason to report if the client exits with a non-zero exit code
     * @param arguments The arguments passed to the client
     * @return The output of the client
     * @throws VcsException If the client cannot be started or exits with a non-zero exit code
     */
    @NotNull
    protected String run(@NotNull Path workingDirectory, @NotNull Reason failureReason, @NotNull String @NotNull... arguments) throws VcsException {
        List<String> command = new ArrayList<>();
        command.add(this.executable);
        command.addAll(Arrays.asList(arguments));
        LoggingAdapter.getDefaultLogger().debug(CommandLineVcsGateway.class, "Running {} in {}", command, workingDirectory);

        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .redirectInput(ProcessBuilder.Redirect.PIPE);
        // Never let a client block on a credential prompt
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new VcsException(Reason.UNREACHABLE, "Unable to run " + this.executable, e);
        }

        String output;
        try {
            process.getOutputStream().close();
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new VcsException(failureReason, "Unexpected exit code " + exitCode + " of " + command + ": " + output.trim());
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new VcsException(Reason.UNREACHABLE, "Unable to read the output of " + command, e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new VcsException(Reason.UNREACHABLE, "Interrupted while waiting for " + command, e);
        }
        return output;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public CommandLineVcsGateway setExecutable(@NotNull String executable) {
        this.executable = Objects.requireNonNull(executable, "executable may not be null");
        return this;
    }
}
