package app.chatarchive.conversation;

import java.time.Instant;

import app.chatarchive.graph.MessageRole;

/**
 * One entry of a linearized conversation. {@code sequenceIndex} is the 0-based position in the
 * thread; {@code nodeId} names the graph node the message was produced from.
 */
public record Message(String nodeId,
                      MessageRole role,
                      String displayText,
                      Instant timestamp,
                      int sequenceIndex) {
}
