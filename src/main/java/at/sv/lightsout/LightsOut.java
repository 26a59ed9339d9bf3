package at.sv.lightsout;

import at.sv.lightsout.api.BridgeAuthenticationFailure;
import at.sv.lightsout.api.BridgeConnectionFailure;
import at.sv.lightsout.api.HttpResourceProviderImpl;
import at.sv.lightsout.api.LightGateway;
import at.sv.lightsout.api.hue.HueBridgeGateway;
import at.sv.lightsout.automation.Automation;
import at.sv.lightsout.automation.AutomationDefinitionParser;
import at.sv.lightsout.automation.InvalidAutomationDefinition;
import at.sv.lightsout.scheduling.JobSchedulerImpl;
import at.sv.lightsout.store.InMemoryEventStore;
import at.sv.lightsout.time.SimpleSunTimesProvider;
import at.sv.lightsout.time.SunTimesProvider;
import at.sv.lightsout.time.SunTimesProviderImpl;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

@Slf4j
@Command(name = "LightsOut", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Learns how your lights are used, predicts upcoming lighting needs and runs light automations.")
public final class LightsOut implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            index = "0",
            defaultValue = "${env:BRIDGE_HOST}",
            description = "The host of your Philips Hue Bridge, e.g. 192.168.0.157")
    String bridgeHost;
    @Parameters(
            index = "1",
            defaultValue = "${env:BRIDGE_USERNAME}",
            description = "The Philips Hue Bridge username used for authentication.")
    String username;
    @Option(names = "--automations", paramLabel = "<file>",
            defaultValue = "${env:AUTOMATIONS_FILE}",
            description = "Optional json file with automation definitions.")
    Path automationsFile;
    @Option(names = "--lat",
            defaultValue = "${env:LAT:-59.3293}",
            description = "The latitude of your location in degrees [-90..90]. Default: ${DEFAULT-VALUE}")
    double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG:-18.0686}",
            description = "The longitude of your location in degrees [-180..180]. Default: ${DEFAULT-VALUE}")
    double longitude;
    @Option(names = "--elevation", paramLabel = "<meters>",
            defaultValue = "${env:ELEVATION:-0.0}",
            description = "The optional elevation (in meters) of your location. Only used with --precise-sun-times.")
    double elevation;
    @Option(names = "--time-zone", paramLabel = "<zone>",
            defaultValue = "${env:TIME_ZONE}",
            description = "The time zone of your location, e.g. Europe/Stockholm. Default: the system time zone.")
    String timeZone;
    @Option(names = "--precise-sun-times",
            defaultValue = "${env:PRECISE_SUN_TIMES:-false}",
            description = "Use a precise solar position library instead of the simplified calculation for " +
                          "sunrise and sunset.")
    boolean preciseSunTimes;
    @Option(names = "--min-occurrences", paramLabel = "<count>",
            defaultValue = "${env:MIN_OCCURRENCES:-3}",
            description = "The minimum number of observations for a pattern. Default: ${DEFAULT-VALUE}")
    int minOccurrences;
    @Option(names = "--time-window", paramLabel = "<minutes>",
            defaultValue = "${env:TIME_WINDOW:-15}",
            description = "The maximum delay between two events of a sequence pattern. Default: ${DEFAULT-VALUE}")
    int timeWindowMinutes;
    @Option(names = "--confidence-threshold", paramLabel = "<confidence>",
            defaultValue = "${env:CONFIDENCE_THRESHOLD:-0.7}",
            description = "The minimum confidence [0..1] of mined patterns. Default: ${DEFAULT-VALUE}")
    double confidenceThreshold;
    @Option(names = "--min-confidence", paramLabel = "<confidence>",
            defaultValue = "${env:MIN_CONFIDENCE:-0.7}",
            description = "The minimum confidence [0..1] of patterns used for predictions. Default: ${DEFAULT-VALUE}")
    double minConfidence;
    @Option(names = "--lookahead", paramLabel = "<minutes>",
            defaultValue = "${env:LOOKAHEAD:-5}",
            description = "How far ahead time based patterns are predicted. Default: ${DEFAULT-VALUE}")
    int lookaheadMinutes;
    @Option(names = "--analysis-window-days", paramLabel = "<days>",
            defaultValue = "${env:ANALYSIS_WINDOW_DAYS:-30}",
            description = "The number of days of events analyzed by the daily pattern analysis. " +
                          "Default: ${DEFAULT-VALUE}")
    int analysisWindowDays;
    @Option(names = "--retention-days", paramLabel = "<days>",
            defaultValue = "${env:RETENTION_DAYS:-90}",
            description = "Events older than this are deleted by the weekly cleanup. Default: ${DEFAULT-VALUE}")
    int retentionDays;
    @Option(names = "--poll-interval", paramLabel = "<seconds>",
            defaultValue = "${env:POLL_INTERVAL:-10}",
            description = "The interval for polling the light states. Default: ${DEFAULT-VALUE}")
    int pollIntervalInSeconds;
    @Option(names = "--enable-reactions",
            defaultValue = "${env:ENABLE_REACTIONS:-false}",
            description = "Trigger the responses of learned sequence patterns when their trigger event is detected.")
    boolean enableReactions;
    @Option(names = "--dry-run", negatable = true,
            defaultValue = "${env:DRY_RUN:-true}", fallbackValue = "true",
            description = "Only log triggered reactions instead of sending them to the lights. " +
                          "Default: ${DEFAULT-VALUE}")
    boolean dryRun;
    @Option(names = "--adaptive-poll-interval", paramLabel = "<seconds>",
            defaultValue = "${env:ADAPTIVE_POLL_INTERVAL:-3}",
            description = "The interval of the adaptive brightness loops. Default: ${DEFAULT-VALUE}")
    int adaptivePollIntervalInSeconds;
    @Option(names = "--adaptive-error-backoff", paramLabel = "<seconds>",
            defaultValue = "${env:ADAPTIVE_ERROR_BACKOFF:-5}",
            description = "The retry delay of an adaptive brightness loop after an error. Default: ${DEFAULT-VALUE}")
    int adaptiveErrorBackoffInSeconds;

    private Supplier<ZonedDateTime> currentTime;
    private LightsOutEngine engine;

    public static void main(String[] args) {
        int execute = new CommandLine(new LightsOut()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ZoneId zone = getZone();
        currentTime = () -> ZonedDateTime.now(zone);
        LightGateway gateway = new HueBridgeGateway(new HttpResourceProviderImpl(new OkHttpClient()), bridgeHost,
                username);
        JobSchedulerImpl jobScheduler = new JobSchedulerImpl(Executors.newSingleThreadScheduledExecutor(),
                Executors.newCachedThreadPool(), currentTime);
        engine = new LightsOutEngine(gateway, new InMemoryEventStore(), createSunTimesProvider(), jobScheduler,
                currentTime, Ticker.systemTicker(), createSettings());
        registerAutomations();
        assertConnectionAndStart(gateway, jobScheduler);
    }

    EngineSettings createSettings() {
        return EngineSettings.builder()
                             .minOccurrences(minOccurrences)
                             .timeWindowMinutes(timeWindowMinutes)
                             .confidenceThreshold(confidenceThreshold)
                             .minConfidence(minConfidence)
                             .lookaheadMinutes(lookaheadMinutes)
                             .analysisWindowDays(analysisWindowDays)
                             .retentionDays(retentionDays)
                             .pollInterval(Duration.ofSeconds(pollIntervalInSeconds))
                             .enableReactions(enableReactions)
                             .dryRun(dryRun)
                             .adaptivePollInterval(Duration.ofSeconds(adaptivePollIntervalInSeconds))
                             .adaptiveErrorBackoff(Duration.ofSeconds(adaptiveErrorBackoffInSeconds))
                             .build();
    }

    private SunTimesProvider createSunTimesProvider() {
        if (preciseSunTimes) {
            return new SunTimesProviderImpl(latitude, longitude, elevation);
        }
        return new SimpleSunTimesProvider(latitude, longitude);
    }

    private ZoneId getZone() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timeZone.trim());
    }

    void assertConfigurationParameters() {
        assertBridgeConfiguration();
        assertGeographicConfigurations();
        assertMiningConfigurations();
        assertTimingConfigurations();
    }

    private void assertBridgeConfiguration() {
        if (bridgeHost == null || bridgeHost.isBlank()) {
            fail("Missing bridge host. Provide it as first parameter or via BRIDGE_HOST");
        }
        if (username == null || username.isBlank()) {
            fail("Missing bridge username. Provide it as second parameter or via BRIDGE_USERNAME");
        }
        if (automationsFile != null && !Files.isReadable(automationsFile)) {
            fail("--automations file '" + automationsFile.toAbsolutePath() + "' does not exist or is not readable");
        }
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (timeZone != null && !timeZone.isBlank()) {
            try {
                ZoneId.of(timeZone.trim());
            } catch (DateTimeException e) {
                fail("--time-zone '" + timeZone + "' is not a valid time zone");
            }
        }
    }

    private void assertMiningConfigurations() {
        if (minOccurrences < 1) {
            fail("--min-occurrences must be >= 1");
        }
        if (timeWindowMinutes <= 0) {
            fail("--time-window must be > 0");
        }
        if (confidenceThreshold < 0 || confidenceThreshold > 1) {
            fail("--confidence-threshold must be within [0,1]");
        }
        if (minConfidence < 0 || minConfidence > 1) {
            fail("--min-confidence must be within [0,1]");
        }
        if (lookaheadMinutes < 0) {
            fail("--lookahead must be >= 0");
        }
        if (analysisWindowDays <= 0) {
            fail("--analysis-window-days must be > 0");
        }
        if (retentionDays <= 0) {
            fail("--retention-days must be > 0");
        }
    }

    private void assertTimingConfigurations() {
        if (pollIntervalInSeconds <= 0) {
            fail("--poll-interval must be > 0");
        }
        if (adaptivePollIntervalInSeconds <= 0) {
            fail("--adaptive-poll-interval must be > 0");
        }
        if (adaptiveErrorBackoffInSeconds <= 0) {
            fail("--adaptive-error-backoff must be > 0");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private void registerAutomations() {
        if (automationsFile == null) {
            return;
        }
        try {
            List<Automation> automations = new AutomationDefinitionParser().parse(automationsFile);
            engine.registerAutomations(automations);
            log.info("Registered {} automations from '{}'", automations.size(), automationsFile);
        } catch (InvalidAutomationDefinition e) {
            System.err.println("Failed to read automations: " + e.getLocalizedMessage());
            System.exit(2);
        }
    }

    private void assertConnectionAndStart(LightGateway gateway, JobSchedulerImpl jobScheduler) {
        if (!assertConnection(gateway)) {
            jobScheduler.scheduleOnce("connect", currentTime.get().plusSeconds(5),
                    () -> assertConnectionAndStart(gateway, jobScheduler));
            return;
        }
        engine.start();
    }

    private boolean assertConnection(LightGateway gateway) {
        MDC.put("context", "init");
        try {
            int lights = gateway.readStates().size();
            log.info("Connected to {}, {} lights found.", bridgeHost, lights);
        } catch (BridgeConnectionFailure e) {
            log.warn("Bridge not reachable: '{}'. Retrying in 5s.", e.getLocalizedMessage());
            return false;
        } catch (BridgeAuthenticationFailure e) {
            System.err.println("Bridge connection rejected: 'Unauthorized user'. Please make sure you use the " +
                               "correct username from the bridge setup process, or generate a new one.");
            System.exit(3);
        }
        return true;
    }
}
