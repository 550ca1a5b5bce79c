package resmon.condor;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs a command line tool to completion. Lets the HTCondor adapter be tested
 * without the tools installed.
 */
public interface CommandRunner {

    /**
     * @param command executable followed by its arguments
     * @param timeout longest time the command may run
     * @return exit code and output
     * @throws IOException          if the command cannot be started or does not finish in time
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
