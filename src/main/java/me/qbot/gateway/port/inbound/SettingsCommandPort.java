package me.qbot.gateway.port.inbound;

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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for administrative settings commands. The transport has already split
 * the command into a name and arguments; the context map carries
 * {@code userId}, {@code channelType} ({@code group} or {@code private}) and,
 * in groups, {@code groupId}.
 */
public interface SettingsCommandPort {

    String CONTEXT_USER_ID = "userId";
    String CONTEXT_GROUP_ID = "groupId";
    String CONTEXT_CHANNEL_TYPE = "channelType";

    /**
     * Executes a command. Never completes exceptionally for a rejected request;
     * rejections are failed results.
     */
    CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    /**
     * Returns all available commands with their definitions.
     */
    List<CommandDefinition> listCommands();

    /**
     * Result of a command: accepted or rejected, with the text to show.
     */
    record CommandResult(
            boolean success,
            String output,
            Object data
    ) {
        public static CommandResult success(String output) {
            return new CommandResult(true, output, null);
        }

        public static CommandResult success(String output, Object data) {
            return new CommandResult(true, output, data);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error, null);
        }
    }

    record CommandDefinition(
            String name,
            String description,
            String usage
    ) {}
}
