package com.linkscout.app.cli;

import com.linkscout.app.logging.LogSetup;
import com.linkscout.core.model.AuditConfig;
import com.linkscout.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private Main() {}

    public static void main(String[] args) {
        AuditConfig config;
        try {
            config = loadConfig();
        } catch (IOException e) {
            System.err.println("Cannot read config: " + e.getMessage());
            System.exit(LinkScoutCli.EXIT_IO);
            return;
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid config: " + e.getMessage());
            System.exit(LinkScoutCli.EXIT_USAGE);
            return;
        }

        // 로그 초기화 (-Dls.out.dir 없으면 설정의 output.dir)
        LogSetup.configure(config.getOutputDir());
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught in {}", t.getName(), e));

        int code = new LinkScoutCli(config, System.out, System.err).run(args);
        System.exit(code);
    }

    /**
     * -Dls.config 가 있으면 그 파일(없으면 IOException),
     * 아니면 작업 디렉터리의 linkscout.yml, 그것도 없으면 기본값.
     */
    static AuditConfig loadConfig() throws IOException {
        String explicit = System.getProperty("ls.config");
        AuditConfig config = (explicit != null && !explicit.isBlank())
                ? YamlConfigLoader.load(Path.of(explicit.trim()))
                : YamlConfigLoader.loadOrDefaults(Path.of(YamlConfigLoader.DEFAULT_FILE));

        String outDir = System.getProperty("ls.out.dir");
        if (outDir != null && !outDir.isBlank()) config.setOutputDir(Path.of(outDir.trim()));
        return config;
    }
}
