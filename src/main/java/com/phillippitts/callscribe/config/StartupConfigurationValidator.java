package com.phillippitts.callscribe.config;

import com.phillippitts.callscribe.config.properties.DeliveryProperties;
import com.phillippitts.callscribe.config.properties.SessionProperties;
import com.phillippitts.callscribe.config.properties.TranscriptProperties;
import com.phillippitts.callscribe.config.stt.PythonSttConfig;
import com.phillippitts.callscribe.config.stt.SttProperties;
import com.phillippitts.callscribe.config.stt.VoskConfig;
import com.phillippitts.callscribe.config.stt.WhisperConfig;
import com.phillippitts.callscribe.exception.InvalidConfigurationException;
import com.phillippitts.callscribe.exception.ModelNotFoundException;
import com.phillippitts.callscribe.service.stt.python.PythonCommand;
import com.phillippitts.callscribe.util.SafePaths;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Checks cross-property requirements that bean validation cannot express and aborts startup with
 * an actionable message when one fails.
 *
 * <p>Validation performed:
 * <ul>
 *   <li>session: guild id present and numeric</li>
 *   <li>delivery: Telegram token and chat id when Telegram is enabled; https webhook URLs</li>
 *   <li>paths: transcript directory and intro clip stay inside the working directory</li>
 *   <li>stt: binaries, models or the python command of the selected engine exist</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(name = "startup.validation.enabled", havingValue = "true", matchIfMissing = true)
class StartupConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(StartupConfigurationValidator.class);

    private static final Pattern NUMERIC_ID = Pattern.compile("^\\d{5,30}$");
    private static final Pattern TELEGRAM_CHAT = Pattern.compile("^(-?\\d+|@[A-Za-z0-9_]{5,})$");
    private static final Pattern TELEGRAM_TOKEN = Pattern.compile("^\\d+:[A-Za-z0-9_-]+$");

    private final SessionProperties session;
    private final DeliveryProperties delivery;
    private final TranscriptProperties transcript;
    private final SttProperties stt;
    private final WhisperConfig whisper;
    private final VoskConfig vosk;
    private final PythonSttConfig python;

    StartupConfigurationValidator(SessionProperties session,
                                  DeliveryProperties delivery,
                                  TranscriptProperties transcript,
                                  SttProperties stt,
                                  WhisperConfig whisper,
                                  VoskConfig vosk,
                                  PythonSttConfig python) {
        this.session = session;
        this.delivery = delivery;
        this.transcript = transcript;
        this.stt = stt;
        this.whisper = whisper;
        this.vosk = vosk;
        this.python = python;
    }

    @PostConstruct
    void validateAllOnStartup() {
        validateSession();
        validateDelivery();
        validatePaths();
        validateSttEngine();
        LOG.info("Startup configuration OK: guild={}, stt.engine={}, transcript.dir={}",
                session.getGuildId(), stt.getEngine(), transcript.getDir());
    }

    // Visible for tests
    void validateSession() {
        String guildId = session.getGuildId();
        if (guildId == null || guildId.isBlank()) {
            throw new InvalidConfigurationException("session.guild-id", "is required");
        }
        if (!NUMERIC_ID.matcher(guildId.trim()).matches()) {
            throw new InvalidConfigurationException("session.guild-id", "must be numeric (got: " + guildId + ")");
        }
    }

    // Visible for tests
    void validateDelivery() {
        DeliveryProperties.Telegram telegram = delivery.getTelegram();
        if (telegram.isEnabled()) {
            if (isBlank(telegram.getBotToken())) {
                throw new InvalidConfigurationException("delivery.telegram.bot-token", "is required");
            }
            if (!TELEGRAM_TOKEN.matcher(telegram.getBotToken().trim()).matches()) {
                throw new InvalidConfigurationException("delivery.telegram.bot-token", "is malformed");
            }
            if (isBlank(telegram.getChatId()) || !TELEGRAM_CHAT.matcher(telegram.getChatId().trim()).matches()) {
                throw new InvalidConfigurationException("delivery.telegram.chat-id",
                        "must be a numeric id or @channel (got: " + telegram.getChatId() + ")");
            }
        } else if (telegram.isRequired()) {
            LOG.warn("delivery.telegram.required=true has no effect while Telegram is disabled");
        }
        DeliveryProperties.Slack slack = delivery.getSlack();
        if (slack.isEnabled()) {
            requireHttps("delivery.slack.webhook-url", slack.getWebhookUrl());
        }
        DeliveryProperties.Webhook webhook = delivery.getWebhook();
        if (webhook.isEnabled()) {
            String url = webhook.getUrl();
            if (isBlank(url) || !(url.startsWith("https://") || url.startsWith("http://"))) {
                throw new InvalidConfigurationException("delivery.webhook.url", "must be an http(s) URL");
            }
            if (url.startsWith("http://")) {
                LOG.warn("delivery.webhook.url uses plain http; summaries travel unencrypted");
            }
        }
    }

    // Visible for tests
    void validatePaths() {
        SafePaths.resolveWithinCwd("transcript.dir", transcript.getDir(), transcript.isAllowAbsolutePaths());
        SessionProperties.Intro intro = session.getIntro();
        if (intro.isEnabled()) {
            Path clip = SafePaths.resolveWithinCwd("session.intro.path", intro.getPath(), false);
            if (!Files.isRegularFile(clip)) {
                LOG.warn("Intro clip not found at {}; the intro will be skipped", clip);
            }
        }
    }

    // Visible for tests
    void validateSttEngine() {
        switch (stt.getEngine()) {
            case WHISPER_CPP -> validateWhisper();
            case FASTER_WHISPER -> validatePython();
            case VOSK -> validateVosk();
            default -> throw new IllegalStateException("Unhandled engine " + stt.getEngine());
        }
    }

    private void validateWhisper() {
        Path binary = Path.of(whisper.binaryPath()).toAbsolutePath().normalize();
        Path model = Path.of(whisper.modelPath()).toAbsolutePath().normalize();
        if (!Files.isRegularFile(model)) {
            throw new ModelNotFoundException(model.toString());
        }
        if (!Files.isRegularFile(binary)) {
            throw new ModelNotFoundException(binary.toString());
        }
        if (!Files.isExecutable(binary)) {
            throw new InvalidConfigurationException("stt.whisper.binary-path",
                    "binary is not executable (try: chmod +x '" + binary + "')");
        }
        LOG.info("Whisper validation OK: model='{}', binary='{}'", model, binary);
    }

    private void validatePython() {
        PythonCommand command = PythonCommand.parse(python.command());
        Path script = Path.of(command.arguments().get(0)).toAbsolutePath().normalize();
        if (!Files.isRegularFile(script)) {
            throw new InvalidConfigurationException("stt.python.command", "script not found: " + script);
        }
        LOG.info("faster-whisper validation OK: executable='{}', script='{}'", command.executable(), script);
    }

    private void validateVosk() {
        Path modelDir = Path.of(vosk.modelPath()).toAbsolutePath().normalize();
        if (!Files.isDirectory(modelDir)) {
            throw new ModelNotFoundException(modelDir.toString());
        }
        LOG.info("Vosk validation OK: model='{}'", modelDir);
    }

    private static void requireHttps(String property, String url) {
        if (isBlank(url) || !url.startsWith("https://")) {
            throw new InvalidConfigurationException(property, "must be an https URL");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
