package com.williamcallahan.chatlatex.service.math;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.domain.math.ToolchainStatus;
import com.williamcallahan.chatlatex.support.ExternalCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Checks which TeX binaries are installed by asking each one for its version.
 */
@Component
public class LatexToolchainProbe {

    private static final Logger logger = LoggerFactory.getLogger(LatexToolchainProbe.class);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    private final AppProperties appProperties;
    private final ExternalCommandRunner commandRunner;

    public LatexToolchainProbe(AppProperties appProperties, ExternalCommandRunner commandRunner) {
        this.appProperties = appProperties;
        this.commandRunner = commandRunner;
    }

    public ToolchainStatus probe() {
        return new ToolchainStatus(
            responds(appProperties.getMath().getLatexCommand()),
            responds(appProperties.getMath().getDvipngCommand()),
            responds(appProperties.getExport().getCompilerCommand()));
    }

    private boolean responds(String command) {
        try {
            return commandRunner.run(List.of(command, "--version"), null, PROBE_TIMEOUT).succeeded();
        } catch (IOException startFailure) {
            logger.info("{} is not available: {}", command, startFailure.getMessage());
            return false;
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
