package com.questrail.telerelay.protocol.codec.impl;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.protocol.codec.MalformedMessageException;
import com.questrail.telerelay.protocol.codec.MessageCodec;
import com.questrail.telerelay.protocol.model.Acknowledgement;
import com.questrail.telerelay.protocol.model.Command;
import com.questrail.telerelay.protocol.model.DataStatus;
import com.questrail.telerelay.protocol.model.GeoPosition;
import com.questrail.telerelay.protocol.model.Hello;
import com.questrail.telerelay.protocol.model.RelayMessage;
import com.questrail.telerelay.protocol.model.TelemetryPacket;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * JsonMessageCodec
 * -----------------------------------------------------------------------------
 * Gson-backed {@link MessageCodec}.
 *
 * <p>Messages are built and read through Gson's tree model so that field
 * presence and JSON types can be validated explicitly; every violation is
 * reported as a {@link MalformedMessageException}.</p>
 *
 * <p>This class is stateless and thread-safe.</p>
 */
public final class JsonMessageCodec implements MessageCodec
{
    static final String TYPE = "type";

    static final String TYPE_HELLO = "hello";
    static final String TYPE_TELEMETRY = "sensor_data";
    static final String TYPE_COMMAND = "command";
    static final String TYPE_ACK = "actuator_status";

    static final String AGENT_ID = "id";
    static final String ROLE = "role";
    static final String VOLTAGE = "voltage";
    static final String STATUS = "status";
    static final String POSITION = "gps";
    static final String SEND_TIME = "timestamp";
    static final String REQUEST_ID = "request_id";
    static final String RECEIPT_TIME = "t2";
    static final String REPLY_SEND_TIME = "t3";
    static final String APPLIED_VOLTAGE = "voltage_set";

    private final Gson gson = new Gson();

    @Override
    public byte[] encode(RelayMessage message)
    {
        Objects.requireNonNull(message, "message");

        JsonObject json = new JsonObject();
        if (message instanceof Hello hello) {
            json.addProperty(TYPE, TYPE_HELLO);
            json.addProperty(AGENT_ID, hello.agentId());
            json.addProperty(ROLE, hello.role().wireName());
        } else if (message instanceof TelemetryPacket packet) {
            json.addProperty(TYPE, TYPE_TELEMETRY);
            json.addProperty(VOLTAGE, packet.voltage());
            json.addProperty(STATUS, packet.status().label());
            json.add(POSITION, positionToJson(packet.position()));
            json.addProperty(SEND_TIME, packet.sendTime());
        } else if (message instanceof Command command) {
            json.addProperty(TYPE, TYPE_COMMAND);
            json.addProperty(REQUEST_ID, command.requestId());
            json.addProperty(VOLTAGE, command.voltage());
            json.addProperty(STATUS, command.status().label());
        } else if (message instanceof Acknowledgement ack) {
            json.addProperty(TYPE, TYPE_ACK);
            if (ack.requestId().isPresent()) {
                json.addProperty(REQUEST_ID, ack.requestId().getAsLong());
            }
            json.addProperty(RECEIPT_TIME, ack.receiptTime());
            json.addProperty(REPLY_SEND_TIME, ack.replySendTime());
            if (ack.appliedVoltage().isPresent()) {
                json.addProperty(APPLIED_VOLTAGE, ack.appliedVoltage().getAsDouble());
            }
            json.add(POSITION, positionToJson(ack.position()));
        } else {
            throw new IllegalArgumentException("Unsupported message: " + message.getClass().getName());
        }

        return gson.toJson(json).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public RelayMessage decode(byte[] payload)
    {
        if (payload == null || payload.length == 0) {
            throw new MalformedMessageException("Empty payload");
        }

        final JsonObject json;
        try {
            JsonElement root = JsonParser.parseString(new String(payload, StandardCharsets.UTF_8));
            if (!root.isJsonObject()) {
                throw new MalformedMessageException("Payload is not a JSON object");
            }
            json = root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new MalformedMessageException("Payload is not valid JSON", e);
        }

        String type = requireString(json, TYPE);
        return switch (type) {
            case TYPE_HELLO -> decodeHello(json);
            case TYPE_TELEMETRY -> decodeTelemetry(json);
            case TYPE_COMMAND -> decodeCommand(json);
            case TYPE_ACK -> decodeAcknowledgement(json);
            default -> throw new MalformedMessageException("Unknown message type: " + type);
        };
    }

    // -------------------------------------------------------------------------
    // Per-type decoding
    // -------------------------------------------------------------------------

    private static Hello decodeHello(JsonObject json)
    {
        String agentId = requireString(json, AGENT_ID);
        String roleName = requireString(json, ROLE);
        Role role = Role.fromWireName(roleName)
                .orElseThrow(() -> new MalformedMessageException("Unknown role: " + roleName));
        return new Hello(agentId, role);
    }

    private static TelemetryPacket decodeTelemetry(JsonObject json)
    {
        return new TelemetryPacket(
                requireDouble(json, VOLTAGE),
                requireStatus(json),
                optionalPosition(json),
                requireDouble(json, SEND_TIME)
        );
    }

    private static Command decodeCommand(JsonObject json)
    {
        return new Command(
                requireLong(json, REQUEST_ID),
                requireDouble(json, VOLTAGE),
                requireStatus(json)
        );
    }

    private static Acknowledgement decodeAcknowledgement(JsonObject json)
    {
        OptionalLong requestId = isAbsent(json, REQUEST_ID)
                ? OptionalLong.empty()
                : OptionalLong.of(requireLong(json, REQUEST_ID));
        OptionalDouble applied = isAbsent(json, APPLIED_VOLTAGE)
                ? OptionalDouble.empty()
                : OptionalDouble.of(requireDouble(json, APPLIED_VOLTAGE));

        return new Acknowledgement(
                requestId,
                requireDouble(json, RECEIPT_TIME),
                requireDouble(json, REPLY_SEND_TIME),
                applied,
                optionalPosition(json)
        );
    }

    // -------------------------------------------------------------------------
    // Field helpers
    // -------------------------------------------------------------------------

    private static boolean isAbsent(JsonObject json, String field)
    {
        JsonElement e = json.get(field);
        return e == null || e.isJsonNull();
    }

    private static JsonPrimitive requirePrimitive(JsonObject json, String field)
    {
        JsonElement e = json.get(field);
        if (e == null || e.isJsonNull()) {
            throw new MalformedMessageException("Missing field '" + field + "'");
        }
        if (!e.isJsonPrimitive()) {
            throw new MalformedMessageException("Field '" + field + "' is not a primitive");
        }
        return e.getAsJsonPrimitive();
    }

    private static String requireString(JsonObject json, String field)
    {
        JsonPrimitive p = requirePrimitive(json, field);
        if (!p.isString()) {
            throw new MalformedMessageException("Field '" + field + "' is not a string");
        }
        return p.getAsString();
    }

    private static double requireDouble(JsonObject json, String field)
    {
        JsonPrimitive p = requirePrimitive(json, field);
        if (!p.isNumber()) {
            throw new MalformedMessageException("Field '" + field + "' is not a number");
        }
        double value = p.getAsDouble();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new MalformedMessageException("Field '" + field + "' is not finite");
        }
        return value;
    }

    private static long requireLong(JsonObject json, String field)
    {
        JsonPrimitive p = requirePrimitive(json, field);
        if (!p.isNumber()) {
            throw new MalformedMessageException("Field '" + field + "' is not a number");
        }
        try {
            return p.getAsBigDecimal().longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new MalformedMessageException("Field '" + field + "' is not an integer", e);
        }
    }

    private static DataStatus requireStatus(JsonObject json)
    {
        String label = requireString(json, STATUS);
        return DataStatus.fromLabel(label)
                .orElseThrow(() -> new MalformedMessageException("Unknown status: " + label));
    }

    private static Optional<GeoPosition> optionalPosition(JsonObject json)
    {
        JsonElement e = json.get(POSITION);
        if (e == null || e.isJsonNull()) {
            return Optional.empty();
        }
        if (!e.isJsonArray() || e.getAsJsonArray().size() != 2) {
            throw new MalformedMessageException("Field '" + POSITION + "' must be [lat, lon] or null");
        }
        JsonArray pair = e.getAsJsonArray();
        try {
            return Optional.of(new GeoPosition(
                    pair.get(0).getAsJsonPrimitive().getAsDouble(),
                    pair.get(1).getAsJsonPrimitive().getAsDouble()));
        } catch (IllegalStateException | NumberFormatException | UnsupportedOperationException e2) {
            throw new MalformedMessageException("Field '" + POSITION + "' must hold two numbers", e2);
        } catch (IllegalArgumentException e2) {
            throw new MalformedMessageException("Field '" + POSITION + "': " + e2.getMessage(), e2);
        }
    }

    private static JsonElement positionToJson(Optional<GeoPosition> position)
    {
        if (position.isEmpty()) {
            return JsonNull.INSTANCE;
        }
        JsonArray pair = new JsonArray();
        pair.add(position.get().latitude());
        pair.add(position.get().longitude());
        return pair;
    }
}
