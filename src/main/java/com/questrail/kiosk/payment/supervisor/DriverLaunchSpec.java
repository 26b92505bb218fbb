package com.questrail.kiosk.payment.supervisor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * How to start the terminal-driver executable.
 *
 * @param executable       path to the driver executable
 * @param arguments        command-line arguments
 * @param workingDirectory directory the driver runs in; its install directory by default
 * @param processName      executable name used to find stale instances
 */
public record DriverLaunchSpec(Path executable, List<String> arguments, Path workingDirectory, String processName)
{
    public DriverLaunchSpec {
        Objects.requireNonNull(executable, "executable");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        if (workingDirectory == null) {
            Path parent = executable.toAbsolutePath().getParent();
            workingDirectory = parent != null ? parent : executable.toAbsolutePath();
        }
        if (processName == null || processName.isBlank()) {
            processName = baseName(executable);
        }
    }

    public static DriverLaunchSpec of(Path executable, String... arguments) {
        return new DriverLaunchSpec(executable, List.of(arguments), null, null);
    }

    public List<String> command() {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(executable.toString());
        command.addAll(arguments);
        return command;
    }

    /**
     * File name without directory and extension: {@code /opt/eft/EftDriver.exe}
     * becomes {@code EftDriver}.
     */
    public static String baseName(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? path.toString() : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
