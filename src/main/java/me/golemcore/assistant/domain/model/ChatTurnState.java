package me.golemcore.assistant.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * States of a single chat turn, in order. {@link #TOOLS_PENDING} and
 * {@link #DONE} are terminal.
 */
public enum ChatTurnState {

    IDLE, SESSION_RESOLVED, USER_APPENDED, CONTEXT_FETCHED, INFERENCE_CALLED, RESPONSE_PARSED, ASSISTANT_APPENDED,
    TOOLS_PENDING, DONE;

    public boolean isTerminal() {
        return this == TOOLS_PENDING || this == DONE;
    }

    /**
     * Guards forward-only progress through the turn.
     */
    public ChatTurnState advanceTo(ChatTurnState next) {
        if (isTerminal() || next.ordinal() <= ordinal()) {
            throw new IllegalStateException("Illegal turn transition " + this + " -> " + next);
        }
        if (next.ordinal() != ordinal() + 1 && !(this == ASSISTANT_APPENDED && next == DONE)) {
            throw new IllegalStateException("Illegal turn transition " + this + " -> " + next);
        }
        return next;
    }
}
