package com.questrail.kiosk.payment.supervisor;

import java.io.IOException;
import java.util.List;

/**
 * Port onto the operating system's process table.
 *
 * <p>The supervisor only ever looks processes up by executable name and starts
 * new ones; a fake implementation stands in for it in tests.</p>
 */
public interface ProcessControl
{
    /**
     * Running processes, other than the current one, whose executable name
     * (without directory and extension) equals {@code processName}.
     */
    List<DriverProcess> findByName(String processName);

    /**
     * Starts the driver described by {@code spec}.
     */
    DriverProcess start(DriverLaunchSpec spec) throws IOException;
}
