package com.parley.channel.dispatch;

import com.parley.channel.discord.DiscordTypes.EventKind;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.common.config.ParleyConfig;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Extracts what the user asked for from an inbound event.
 * <p>
 * Mentions and thread replies carry a free-text query with the bot mention
 * stripped. Slash-style commands {@code /sum-day}, {@code /sum-hr N},
 * {@code /chart-day} and {@code /chart-hr N} ask for a channel summary over a
 * number of hours; the chart variants force visualizations. Any other slash
 * command is treated as a query with its arguments.
 */
public final class CommandParser {

    private CommandParser() {
    }

    private static final Pattern ANY_USER_MENTION = Pattern.compile("<@!?\\d+>");
    private static final int DAY_HOURS = 24;

    public enum CommandType {
        QUERY, SUMMARY, CHART
    }

    /**
     * @param hours       summary window; {@code null} for queries
     * @param forceCharts the reply must include chart visualizations
     */
    public record ParsedCommand(CommandType type, String query, Integer hours, boolean forceCharts) {

        static ParsedCommand query(String text) {
            return new ParsedCommand(CommandType.QUERY, text, null, false);
        }

        /** Query text, or a short form of the command for logs and the store. */
        public String describe() {
            if (type == CommandType.QUERY) {
                return query;
            }
            return (type == CommandType.CHART ? "/chart-hr " : "/sum-hr ") + hours;
        }
    }

    /**
     * Either a command or the notice to send back instead.
     */
    public record ParseResult(ParsedCommand command, String notice) {

        public boolean ok() {
            return command != null;
        }

        static ParseResult of(ParsedCommand command) {
            return new ParseResult(command, null);
        }

        static ParseResult rejected(String notice) {
            return new ParseResult(null, notice);
        }
    }

    public static ParseResult parse(InboundEvent event, ParleyConfig.MessagesConfig messages) {
        String content = event.content() != null ? event.content().trim() : "";
        if (event.kind() == EventKind.SLASH_COMMAND) {
            return parseSlash(content, messages);
        }
        String query = stripBotMention(content, event.botUserId());
        if (query.isEmpty()) {
            return ParseResult.rejected(messages.getNoQuery());
        }
        return ParseResult.of(ParsedCommand.query(query));
    }

    /**
     * Remove the first {@code <@id>} / {@code <@!id>} mention of the bot (any
     * user mention when the bot id is unknown) and trim.
     */
    static String stripBotMention(String content, String botUserId) {
        String stripped;
        if (botUserId != null && !botUserId.isBlank()) {
            stripped = content.replaceFirst("<@!?" + Pattern.quote(botUserId) + ">", "");
        } else {
            stripped = ANY_USER_MENTION.matcher(content).replaceFirst("");
        }
        return stripped.trim();
    }

    private static ParseResult parseSlash(String content, ParleyConfig.MessagesConfig messages) {
        String body = content.startsWith("/") ? content.substring(1) : content;
        String[] parts = body.trim().split("\\s+", 2);
        String name = parts[0].toLowerCase(Locale.ROOT);
        String args = parts.length > 1 ? parts[1].trim() : "";

        return switch (name) {
            case "sum-day" -> ParseResult.of(new ParsedCommand(CommandType.SUMMARY, null, DAY_HOURS, false));
            case "chart-day" -> ParseResult.of(new ParsedCommand(CommandType.CHART, null, DAY_HOURS, true));
            case "sum-hr" -> parseHours(args, CommandType.SUMMARY, messages);
            case "chart-hr" -> parseHours(args, CommandType.CHART, messages);
            default -> {
                yield args.isEmpty()
                        ? ParseResult.rejected(messages.getNoQuery())
                        : ParseResult.of(ParsedCommand.query(args));
            }
        };
    }

    private static ParseResult parseHours(String args, CommandType type, ParleyConfig.MessagesConfig messages) {
        int hours;
        try {
            hours = Integer.parseInt(args.split("\\s+")[0]);
        } catch (NumberFormatException e) {
            return ParseResult.rejected(messages.getInvalidHoursFormat());
        }
        int max = messages.getMaxSummaryHours();
        if (hours < 1 || hours > max) {
            return ParseResult.rejected(messages.getInvalidHoursRange().replace("{max}", String.valueOf(max)));
        }
        return ParseResult.of(new ParsedCommand(type, null, hours, type == CommandType.CHART));
    }
}
