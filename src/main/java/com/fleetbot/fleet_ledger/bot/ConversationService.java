package com.fleetbot.fleet_ledger.bot;

import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-chat conversation state for multi-step bot flows, e.g. "AWAIT_CASH" plus the
 * half-filled weekly entry. Kept in memory only; a restart drops open conversations.
 */
@Service
public class ConversationService {

    private final Map<Long, String> chatState = new ConcurrentHashMap<>();
    private final Map<Long, Object> chatDraft = new ConcurrentHashMap<>();

    public void begin(long chatId, String state, Object draft) {
        chatDraft.put(chatId, draft);
        chatState.put(chatId, state);
    }

    public void moveTo(long chatId, String state) {
        chatState.put(chatId, state);
    }

    public String getState(long chatId) {
        return chatState.get(chatId);
    }

    public void clear(long chatId) {
        chatState.remove(chatId);
        chatDraft.remove(chatId);
    }

    public <T> T getDraft(long chatId, Class<T> type) {
        Object draft = chatDraft.get(chatId);
        if (draft == null) {
            throw new IllegalStateException("No open conversation for chat " + chatId);
        }
        return type.cast(draft);
    }
}
