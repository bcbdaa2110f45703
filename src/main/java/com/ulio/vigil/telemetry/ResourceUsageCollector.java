package com.ulio.vigil.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.SystemInfo;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

import java.util.function.Supplier;

public class ResourceUsageCollector implements Supplier<ResourceUsage> {
    private static final Logger log = LoggerFactory.getLogger(ResourceUsageCollector.class);

    static final String UNAVAILABLE = "oshi not available";

    private final OperatingSystem operatingSystem;
    private final int pid;

    private OSProcess previousProcess;

    public ResourceUsageCollector() {
        OperatingSystem loadedOperatingSystem = null;
        int loadedPid = -1;

        try {
            SystemInfo systemInfo = new SystemInfo();
            loadedOperatingSystem = systemInfo.getOperatingSystem();
            loadedPid = loadedOperatingSystem.getProcessId();
        } catch (Throwable e) {
            log.warn("OSHI initialization failed, resource usage will be reported as unavailable: {}", e.getMessage());
            loadedOperatingSystem = null;
        }

        this.operatingSystem = loadedOperatingSystem;
        this.pid = loadedPid;
    }

    @Override
    public synchronized ResourceUsage get() {
        if (operatingSystem == null) {
            return ResourceUsage.unavailable(UNAVAILABLE);
        }

        try {
            OSProcess process = operatingSystem.getProcess(pid);
            if (process == null) {
                return ResourceUsage.unavailable("process " + pid + " not visible to oshi");
            }

            double cpuPercent = previousProcess == null
                    ? process.getProcessCpuLoadCumulative() * 100.0
                    : process.getProcessCpuLoadBetweenTicks(previousProcess) * 100.0;
            previousProcess = process;

            double memoryMb = process.getResidentSetSize() / 1024.0 / 1024.0;
            return ResourceUsage.available(cpuPercent, memoryMb, process.getOpenFiles(), process.getThreadCount());
        } catch (Throwable e) {
            return ResourceUsage.unavailable(safeMessage(e));
        }
    }

    private static String safeMessage(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message.length() > 200 ? message.substring(0, 200) : message;
    }
}
