package com.punter.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.punter.config.MapDefinition;
import com.punter.model.Move;
import com.punter.model.PunterScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of the game server messages.
 * <p>
 * Moves use a single-key envelope naming the variant, e.g.
 * {@code {"claim":{"punter":0,"source":0,"target":1}}} or {@code {"pass":{"punter":0}}}.
 * Incoming messages are told apart by their first key.
 */
@Component
@RequiredArgsConstructor
public class ProtocolCodec {

    private final ObjectMapper objectMapper;

    /**
     * Parse a message from the server.
     *
     * @throws IllegalArgumentException if the JSON is malformed or the message kind is unknown
     */
    public MessageIn deserialize(String message) {
        JsonNode root;
        try {
            root = objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed message: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || root.isEmpty()) {
            throw new IllegalArgumentException("Message must be a non-empty JSON object: " + message);
        }

        String kind = root.fieldNames().next();
        return switch (kind) {
            case "you" -> new MessageIn.Handshake(required(root, "you").asText());
            case "punter" -> new MessageIn.Setup(
                    intField(root, "punter"),
                    intField(root, "punters"),
                    readMap(required(root, "map")));
            case "move" -> new MessageIn.MoveRequest(decodeMoves(required(required(root, "move"), "moves")));
            case "stop" -> {
                JsonNode stop = required(root, "stop");
                yield new MessageIn.Stop(decodeMoves(required(stop, "moves")), decodeScores(stop.get("scores")));
            }
            case "timeout" -> new MessageIn.Timeout(intField(root, "timeout"));
            default -> throw new IllegalArgumentException("Unknown message kind: " + kind);
        };
    }

    /**
     * Render a message for the server.
     */
    public String serialize(MessageOut message) {
        ObjectNode node;
        if (message instanceof MessageOut.HandshakeOut handshake) {
            node = objectMapper.createObjectNode().put("me", handshake.me());
        } else if (message instanceof MessageOut.Ready ready) {
            node = objectMapper.createObjectNode().put("ready", ready.ready());
        } else if (message instanceof MessageOut.MoveOut moveOut) {
            node = encodeMove(moveOut.move());
        } else {
            throw new IllegalArgumentException("Unsupported message: " + message);
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + message, e);
        }
    }

    public ObjectNode encodeMove(Move move) {
        ObjectNode root = objectMapper.createObjectNode();
        if (move instanceof Move.Claim claim) {
            root.putObject("claim")
                    .put("punter", claim.punter())
                    .put("source", claim.source())
                    .put("target", claim.target());
        } else if (move instanceof Move.Pass pass) {
            root.putObject("pass").put("punter", pass.punter());
        }
        return root;
    }

    /**
     * @throws IllegalArgumentException if the envelope is not a claim or a pass
     */
    public Move decodeMove(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            throw new IllegalArgumentException("Move must be a non-empty JSON object: " + node);
        }
        String kind = node.fieldNames().next();
        JsonNode body = node.get(kind);
        return switch (kind) {
            case "claim" -> new Move.Claim(
                    intField(body, "punter"),
                    intField(body, "source"),
                    intField(body, "target"));
            case "pass" -> new Move.Pass(intField(body, "punter"));
            default -> throw new IllegalArgumentException("Unknown move kind: " + kind);
        };
    }

    private List<Move> decodeMoves(JsonNode array) {
        if (!array.isArray()) {
            throw new IllegalArgumentException("Moves must be an array: " + array);
        }
        List<Move> moves = new ArrayList<>(array.size());
        for (JsonNode move : array) {
            moves.add(decodeMove(move));
        }
        return moves;
    }

    private List<PunterScore> decodeScores(JsonNode array) {
        if (array == null || array.isNull()) {
            return List.of();
        }
        List<PunterScore> scores = new ArrayList<>(array.size());
        for (JsonNode score : array) {
            scores.add(new PunterScore(intField(score, "punter"), required(score, "score").asLong()));
        }
        return scores;
    }

    private MapDefinition readMap(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, MapDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed map: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "' in " + node);
        }
        return value;
    }

    private static int intField(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException("Field '" + field + "' is not an integer: " + value);
        }
        return value.asInt();
    }
}
