package at.sv.lightsout.automation;

import at.sv.lightsout.InvalidPropertyValue;
import at.sv.lightsout.WeekdayParser;
import at.sv.lightsout.api.LightCommand;
import at.sv.lightsout.api.TargetType;
import at.sv.lightsout.automation.AutomationAction.ActionSequence;
import at.sv.lightsout.automation.AutomationAction.SequenceStep;
import at.sv.lightsout.automation.AutomationAction.SingleAction;
import at.sv.lightsout.automation.AutomationTrigger.ManualTrigger;
import at.sv.lightsout.automation.AutomationTrigger.SunTrigger;
import at.sv.lightsout.automation.AutomationTrigger.TimeTrigger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Reads automation definitions from json. Example:
 * <pre>
 * [
 *   {
 *     "id": 1,
 *     "name": "Wake up",
 *     "trigger": {"type": "time", "time": "06:45", "weekdays": "Mo-Fr"},
 *     "target": {"type": "room", "ids": ["3"]},
 *     "action": {"sequence": [
 *       {"delay": 0, "action": {"on": true, "bri": 1}},
 *       {"delay": 300, "action": {"bri": 254, "transitiontime": 3000}}
 *     ]}
 *   },
 *   {
 *     "id": 2,
 *     "trigger": {"type": "sunset", "offset_minutes": -15},
 *     "target": {"type": "light", "ids": ["1", "2"]},
 *     "action": {"on": true, "brightness": 180, "color_temp": 370}
 *   }
 * ]
 * </pre>
 * Weekdays are either a list of indices (0 = Monday) or day ranges, missing weekdays mean every day.
 */
@Slf4j
public final class AutomationDefinitionParser {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("H:mm");

    private final ObjectMapper mapper;

    public AutomationDefinitionParser() {
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws InvalidAutomationDefinition if the file can't be read or is not a json array
     */
    public List<Automation> parse(Path file) {
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new InvalidAutomationDefinition("Failed to read automations from '" + file + "'", e);
        }
    }

    /**
     * Malformed definitions are logged and skipped.
     *
     * @throws InvalidAutomationDefinition if the input is not a json array
     */
    public List<Automation> parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidAutomationDefinition("Invalid automation json: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new InvalidAutomationDefinition("Expected a json array of automation definitions");
        }
        List<Automation> automations = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            try {
                automations.add(parseAutomation(root.get(i)));
            } catch (InvalidAutomationDefinition | InvalidPropertyValue | IllegalArgumentException e) {
                log.warn("Skipping automation definition #{}: {}", i + 1, e.getLocalizedMessage());
            }
        }
        return automations;
    }

    Automation parseAutomation(JsonNode node) {
        JsonNode id = node.get("id");
        if (id == null || !id.canConvertToLong()) {
            throw new InvalidAutomationDefinition("Missing numeric 'id'");
        }
        return Automation.builder()
                         .id(id.asLong())
                         .name(node.path("name").asText(null))
                         .enabled(node.path("enabled").asBoolean(true))
                         .trigger(parseTrigger(node.path("trigger")))
                         .target(parseTarget(node.path("target")))
                         .action(parseAction(node.path("action")))
                         .build();
    }

    private AutomationTrigger parseTrigger(JsonNode trigger) {
        String type = trigger.path("type").asText("manual").toLowerCase(Locale.ENGLISH);
        return switch (type) {
            case "time" -> new TimeTrigger(parseTime(trigger.path("time").asText("00:00")),
                    parseWeekdays(trigger.path("weekdays")));
            case "sunrise" -> new SunTrigger(SunEvent.SUNRISE, trigger.path("offset_minutes").asInt(0),
                    parseWeekdays(trigger.path("weekdays")));
            case "sunset" -> new SunTrigger(SunEvent.SUNSET, trigger.path("offset_minutes").asInt(0),
                    parseWeekdays(trigger.path("weekdays")));
            case "manual" -> new ManualTrigger();
            default -> throw new InvalidAutomationDefinition("Unknown trigger type '" + type + "'. Supported: " +
                                                             "[time, sunrise, sunset, manual]");
        };
    }

    private static LocalTime parseTime(String time) {
        try {
            return LocalTime.parse(time.trim(), TIME_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new InvalidAutomationDefinition("Invalid time '" + time + "'. Expected HH:mm");
        }
    }

    private static EnumSet<DayOfWeek> parseWeekdays(JsonNode weekdays) {
        if (weekdays.isMissingNode() || weekdays.isNull()) {
            return EnumSet.noneOf(DayOfWeek.class);
        }
        if (weekdays.isTextual()) {
            return WeekdayParser.parse(weekdays.asText());
        }
        if (!weekdays.isArray()) {
            throw new InvalidAutomationDefinition("Invalid weekdays '" + weekdays + "'");
        }
        List<Integer> indices = new ArrayList<>();
        weekdays.forEach(day -> {
            if (!day.canConvertToInt()) {
                throw new InvalidAutomationDefinition("Invalid weekday '" + day + "'");
            }
            indices.add(day.asInt());
        });
        return WeekdayParser.fromIndices(indices);
    }

    private static AutomationTarget parseTarget(JsonNode target) {
        TargetType type = TargetType.fromValue(target.path("type").asText("light"));
        JsonNode ids = target.path("ids");
        if (!ids.isArray() || ids.isEmpty()) {
            throw new InvalidAutomationDefinition("Missing target 'ids'");
        }
        List<String> targetIds = new ArrayList<>();
        ids.forEach(id -> targetIds.add(id.asText().trim()));
        return new AutomationTarget(type, targetIds);
    }

    private AutomationAction parseAction(JsonNode action) {
        if (!action.isObject()) {
            throw new InvalidAutomationDefinition("Missing 'action'");
        }
        JsonNode sequence = action.get("sequence");
        if (sequence == null) {
            return new SingleAction(parseCommand(action));
        }
        if (!sequence.isArray() || sequence.isEmpty()) {
            throw new InvalidAutomationDefinition("'sequence' needs at least one step");
        }
        List<SequenceStep> steps = new ArrayList<>();
        sequence.forEach(step -> steps.add(new SequenceStep(parseDelay(step), parseCommand(step.path("action")))));
        return new ActionSequence(steps);
    }

    private static int parseDelay(JsonNode step) {
        JsonNode delay = step.has("delay_seconds") ? step.get("delay_seconds") : step.path("delay");
        int seconds = delay.asInt(0);
        if (seconds < 0) {
            throw new InvalidAutomationDefinition("Negative step delay '" + seconds + "'");
        }
        return seconds;
    }

    private LightCommand parseCommand(JsonNode action) {
        LightCommand command;
        try {
            command = mapper.treeToValue(action, LightCommand.class);
        } catch (JsonProcessingException e) {
            throw new InvalidAutomationDefinition("Invalid action " + action + ": " + e.getOriginalMessage(), e);
        }
        if (command == null || command.isNullCall()) {
            throw new InvalidAutomationDefinition("Action " + action + " does not change any light property");
        }
        return command;
    }
}
