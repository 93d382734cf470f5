package com.respkv.command;

import com.respkv.config.ServerConfig;
import com.respkv.core.KVStore;
import com.respkv.core.KeyValuePair;
import com.respkv.network.protocol.RespValue;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a decoded request to a command and executes it against the store.
 * Command errors become error replies; they never close the connection.
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    // Longest argument preview included in an unknown-command error
    private static final int MAX_ARGS_PREVIEW = 128;

    /**
     * A command body. Receives the full request, command name included.
     */
    @FunctionalInterface
    interface Handler {
        RespValue execute(List<RespValue> args);
    }

    /**
     * Registry entry. Arity follows the Redis convention: positive means exact
     * element count, negative means at least that many.
     */
    private static final class Registration {
        final String name;
        final int arity;
        final Handler handler;

        Registration(String name, int arity, Handler handler) {
            this.name = name;
            this.arity = arity;
            this.handler = handler;
        }

        boolean acceptsArgCount(int count) {
            return arity >= 0 ? count == arity : count >= -arity;
        }
    }

    private final Map<String, Registration> commands = new HashMap<>();
    private final KVStore store;
    private final ServerConfig config;
    private final MetricsCollector metrics;
    private final Clock clock;

    public CommandDispatcher(KVStore store, ServerConfig config, MetricsCollector metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");

        register("ping", -1, this::ping);
        register("echo", 2, this::echo);
        register("set", -3, this::set);
        register("get", 2, this::get);
        register("del", -2, this::del);
        register("exists", -2, this::exists);
        register("config", -2, this::config);
        register("command", -1, this::command);

        logger.debug("CommandDispatcher initialized with {} commands", commands.size());
    }

    private void register(String name, int arity, Handler handler) {
        commands.put(name, new Registration(name, arity, handler));
    }

    /**
     * Execute one request.
     *
     * @param request an array of bulk strings
     * @return the reply; never null
     */
    public RespValue dispatch(RespValue request) {
        List<RespValue> args = request.getElements();
        if (args == null || args.isEmpty()) {
            return RespValue.error("ERR empty command");
        }

        String name = args.get(0).asString();
        Registration registration = name != null ? commands.get(name.toLowerCase(Locale.ROOT)) : null;
        long start = System.nanoTime();
        RespValue reply;
        try {
            if (registration == null) {
                throw new CommandException(unknownCommandMessage(args));
            }
            if (!registration.acceptsArgCount(args.size())) {
                throw CommandException.wrongArity(registration.name);
            }
            reply = registration.handler.execute(args);
        } catch (CommandException e) {
            logger.debug("Command {} failed: {}", name, e.getMessage());
            reply = RespValue.error(e.getMessage());
        }
        metrics.recordCommand(registration != null ? registration.name : "unknown",
                System.nanoTime() - start, reply.isError());
        return reply;
    }

    private static String unknownCommandMessage(List<RespValue> args) {
        StringBuilder preview = new StringBuilder();
        for (int i = 1; i < args.size() && preview.length() < MAX_ARGS_PREVIEW; i++) {
            preview.append('\'')
                    .append(printablePrefix(args.get(i).getBytesUnsafe(), MAX_ARGS_PREVIEW - preview.length()))
                    .append("' ");
        }
        return "ERR unknown command '" + printablePrefix(args.get(0).getBytesUnsafe(), MAX_ARGS_PREVIEW)
                + "', with args beginning with: " + preview;
    }

    // At most maxBytes of the argument, decoded without copying the rest
    private static String printablePrefix(byte[] bytes, int maxBytes) {
        if (bytes == null) {
            return "";
        }
        return printable(new String(bytes, 0, Math.min(bytes.length, maxBytes), StandardCharsets.UTF_8));
    }

    // Error replies are single lines
    private static String printable(String text) {
        return text == null ? "" : text.replace('\r', ' ').replace('\n', ' ');
    }

    // ==================== Connection ====================

    private RespValue ping(List<RespValue> args) {
        switch (args.size()) {
            case 1:
                return RespValue.pong();
            case 2:
                return RespValue.bulkString(args.get(1).getBytesUnsafe());
            default:
                throw CommandException.wrongArity("ping");
        }
    }

    private RespValue echo(List<RespValue> args) {
        return RespValue.bulkString(args.get(1).getBytesUnsafe());
    }

    private RespValue command(List<RespValue> args) {
        return RespValue.ok();
    }

    // ==================== Strings ====================

    private RespValue set(List<RespValue> args) {
        SetArguments options = SetArguments.parse(args.subList(3, args.size()), clock.millis());
        boolean written = store.set(args.get(1).getBytesUnsafe(), args.get(2).getBytesUnsafe(),
                options.getExpiresAt(), options.getCondition(), options.isKeepTtl());
        return written ? RespValue.ok() : RespValue.nullBulkString();
    }

    private RespValue get(List<RespValue> args) {
        Optional<KeyValuePair> entry = store.get(args.get(1).getBytesUnsafe());
        return entry.isPresent()
                ? RespValue.bulkString(entry.get().getValueUnsafe())
                : RespValue.nullBulkString();
    }

    // ==================== Keyspace ====================

    private RespValue del(List<RespValue> args) {
        long removed = 0;
        for (int i = 1; i < args.size(); i++) {
            if (store.delete(args.get(i).getBytesUnsafe())) {
                removed++;
            }
        }
        return RespValue.integer(removed);
    }

    private RespValue exists(List<RespValue> args) {
        long count = 0;
        for (int i = 1; i < args.size(); i++) {
            if (store.exists(args.get(i).getBytesUnsafe())) {
                count++;
            }
        }
        return RespValue.integer(count);
    }

    // ==================== Server ====================

    private RespValue config(List<RespValue> args) {
        String subcommand = args.get(1).asString();
        if (!"GET".equalsIgnoreCase(subcommand)) {
            throw new CommandException("ERR unknown subcommand '" + printable(subcommand)
                    + "'. Try CONFIG HELP.");
        }
        if (args.size() < 3) {
            throw CommandException.wrongArity("config|get");
        }

        List<RespValue> pairs = new ArrayList<>();
        for (int i = 2; i < args.size(); i++) {
            String name = args.get(i).asString().toLowerCase(Locale.ROOT);
            String value = config.get(name);
            if (value != null) {
                pairs.add(RespValue.bulkString(name));
                pairs.add(RespValue.bulkString(value));
            }
        }
        return RespValue.array(pairs);
    }
}
