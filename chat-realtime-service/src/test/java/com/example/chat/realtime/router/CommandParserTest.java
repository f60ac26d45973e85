package com.example.chat.realtime.router;

import com.example.chat.shared.exception.ChatErrorKind;
import com.example.chat.shared.exception.ChatException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandParserTest {

    private final CommandParser parser = new CommandParser(new ObjectMapper());

    @Test
    void parsesChannelCommand() {
        ChatCommand command = parser.parse("{\"type\":\"channel\",\"room\":\"general\",\"body\":\"hi\"}");

        assertThat(command.getType()).isEqualTo(CommandType.CHANNEL);
        assertThat(command.getRoom()).isEqualTo("general");
        assertThat(command.getBody()).isEqualTo("hi");
    }

    @Test
    void parsesDirectMessageAndModerationCommands() {
        ChatCommand dm = parser.parse("{\"type\":\"dm\",\"to\":\"alice\",\"body\":\"hey\"}");
        ChatCommand block = parser.parse("{\"type\":\"block\",\"userId\":\"bob\"}");

        assertThat(dm.getTo()).isEqualTo("alice");
        assertThat(block.getType().isModeration()).isTrue();
        assertThat(block.getUserId()).isEqualTo("bob");
    }

    @Test
    void emptyBodyIsLeftForMessageValidation() {
        ChatCommand command = parser.parse("{\"type\":\"channel\",\"room\":\"general\",\"body\":\"   \"}");

        assertThat(command.getBody()).isEqualTo("   ");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "[1,2,3]",
            "{}",
            "{\"type\":\"shout\"}",
            "{\"type\":\"join\"}",
            "{\"type\":\"join\",\"room\":\"has space\"}",
            "{\"type\":\"channel\",\"room\":\"general\"}",
            "{\"type\":\"channel\",\"room\":\"general\",\"body\":42}",
            "{\"type\":\"dm\",\"body\":\"hi\"}",
            "{\"type\":\"block\",\"userId\":\"\"}",
            "{\"type\":\"auth\"}"
    })
    void rejectsSchemaViolationsAsMalformed(String frame) {
        assertThatThrownBy(() -> parser.parse(frame))
                .isInstanceOf(ChatException.class)
                .extracting(e -> ((ChatException) e).getKind())
                .isEqualTo(ChatErrorKind.MALFORMED_COMMAND);
    }

    @Test
    void roomNamesAreBounded() {
        String longest = "r".repeat(64);

        assertThat(parser.parse("{\"type\":\"join\",\"room\":\"" + longest + "\"}").getRoom()).isEqualTo(longest);
        assertThatThrownBy(() -> parser.parse("{\"type\":\"join\",\"room\":\"" + longest + "r\"}"))
                .isInstanceOf(ChatException.class);
    }
}
