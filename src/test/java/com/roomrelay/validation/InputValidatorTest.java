package com.roomrelay.validation;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.roomrelay.dto.ErrorResponse.ErrorCode;
import com.roomrelay.exception.RoomException;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator();

    @Test
    void emptyValuesAreAllowed() {
        assertThatCode(() -> {
            validator.validateRoomName(null);
            validator.validateRoomName("");
            validator.validateUsername(null);
            validator.validateUsername("");
            validator.validateRoomPassword(null);
        }).doesNotThrowAnyException();
    }

    @Test
    void roomNamesOfAnyLengthArePrintable() {
        assertThatCode(() -> validator.validateRoomName("r".repeat(500))).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateRoomName("général 🎉")).doesNotThrowAnyException();

        assertThatThrownBy(() -> validator.validateRoomName("bad\nname"))
                .isInstanceOf(RoomException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ROOM_008);
    }

    @Test
    void usernamesOfAnyLengthArePrintable() {
        assertThatCode(() -> validator.validateUsername("u".repeat(200))).doesNotThrowAnyException();

        assertThatThrownBy(() -> validator.validateUsername("tab\there"))
                .isInstanceOf(RoomException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.VAL_004);
    }

    @Test
    void passwordIsLimitedInBytes() {
        assertThatCode(() -> validator.validateRoomPassword("p".repeat(72))).doesNotThrowAnyException();

        // 37 two-byte characters
        assertThatThrownBy(() -> validator.validateRoomPassword("é".repeat(37)))
                .isInstanceOf(RoomException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.VAL_003);
    }
}
