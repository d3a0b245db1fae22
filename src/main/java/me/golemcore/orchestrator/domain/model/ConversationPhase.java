package me.golemcore.orchestrator.domain.model;

/**
 * Lifecycle phase of a conversation.
 *
 * <pre>
 * UNINITIALIZED -> INITIALIZING -> READY <-> PROCESSING -> ... -> ENDED
 * </pre>
 *
 * Any non-terminal phase may move to {@link #ENDED}; {@link #ENDED} is
 * terminal.
 */
public enum ConversationPhase {

    UNINITIALIZED, INITIALIZING, READY, PROCESSING, ENDED
}
