package org.janelia.enhance.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an enhancement tool, logging its outcome and converting it to a process exit status.
 */
public abstract class ClientRunner {

    public static final int SUCCESS_STATUS = 0;
    public static final int FAILURE_STATUS = 1;

    private final String clientName;
    private final String[] args;

    /**
     * @param  clientName  name of the tool used in log messages.
     * @param  args        command line arguments for the tool.
     */
    public ClientRunner(final String clientName,
                        final String[] args) {
        this.clientName = clientName;
        this.args = args;
    }

    /**
     * Runs the tool and exits the JVM with its status.
     */
    public void run() {
        System.exit(runForStatus());
    }

    /**
     * Runs the tool without exiting.
     *
     * @return {@link #SUCCESS_STATUS} or {@link #FAILURE_STATUS}.
     */
    public int runForStatus() {

        LOG.info("runForStatus: entry, client={}", clientName);

        final long startTime = System.currentTimeMillis();

        int status;
        try {
            runClient(args);
            status = SUCCESS_STATUS;
        } catch (final Throwable t) {
            LOG.error("runForStatus: {} failed", clientName, t);
            status = FAILURE_STATUS;
        }

        LOG.info("runForStatus: exit, client={}, status={}, elapsedMilliseconds={}",
                 clientName, status, System.currentTimeMillis() - startTime);

        return status;
    }

    /**
     * @param  args  command line arguments for the tool.
     *
     * @throws Exception
     *   if the tool fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
