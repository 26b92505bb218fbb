package com.questrail.kiosk.payment.supervisor;

/**
 * Handle on an operating-system process that runs (or ran) the terminal driver.
 */
public interface DriverProcess
{
    long pid();

    boolean isAlive();

    /**
     * Forcibly terminates the process and blocks until it has exited.
     *
     * @throws InterruptedException if interrupted while waiting for the exit
     */
    void terminateAndWait() throws InterruptedException;

    /**
     * Registers a callback run once when the process exits. Runs immediately
     * if it has already exited.
     */
    void onExit(Runnable callback);
}
