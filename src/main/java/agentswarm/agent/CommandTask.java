package agentswarm.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs a shell command as the task. Output is inherited; a non-zero exit code is a failure.
 */
public class CommandTask implements AgentTask {

    private static final Logger log = LoggerFactory.getLogger(CommandTask.class);

    private final List<String> command;

    public CommandTask(String shellCommand) {
        this(List.of("sh", "-c", Objects.requireNonNull(shellCommand, "command is required")));
    }

    public CommandTask(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public void run() throws Exception {
        log.info("Running task command: {}", command);
        Process process = new ProcessBuilder(command)
                .inheritIO()
                .start();
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroy();
            throw e;
        }
        if (exitCode != 0) {
            throw new AgentTaskException("command exited with code " + exitCode);
        }
        log.info("Task command finished");
    }

    public List<String> command() {
        return command;
    }
}
