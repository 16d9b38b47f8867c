package com.pingponghub.practice.util;

import com.pingponghub.practice.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class PracticeKeyFactoryTest {

    private static final String ID = "12345678-1234-1234-1234-123456789012";

    @Test
    void getPracticePk_WithValidId_ReturnsPrefixedKey() {
        assertThat(PracticeKeyFactory.getPracticePk(ID)).isEqualTo("PRACTICE#" + ID);
    }

    @Test
    void getRulePk_WithValidId_ReturnsPrefixedKey() {
        assertThat(PracticeKeyFactory.getRulePk(ID)).isEqualTo("RULE#" + ID);
    }

    @Test
    void getPracticePk_WithMalformedId_ThrowsInvalidKey() {
        assertThatThrownBy(() -> PracticeKeyFactory.getPracticePk("not-a-uuid"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid Practice ID format");
        assertThatThrownBy(() -> PracticeKeyFactory.getRulePk(" "))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void getOrganizerTeamKey_CombinesOrganizerAndTeam() {
        assertThat(PracticeKeyFactory.getOrganizerTeamKey("user_2abc", "Tigers"))
            .isEqualTo("ORGANIZER#user_2abc#TEAM#Tigers");
    }

    @Test
    void getOrganizerTeamKey_WithBlankTeam_ThrowsInvalidKey() {
        assertThatThrownBy(() -> PracticeKeyFactory.getOrganizerTeamKey("user_2abc", ""))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void slotKeys_SortWithinTheDayBounds() {
        LocalDate date = LocalDate.of(2024, 2, 10);
        String slot = PracticeKeyFactory.getSessionSlotSk(date, "14:00");

        assertThat(slot).isEqualTo("2024-02-10T14:00");
        assertThat(slot.compareTo(date.toString())).isPositive();
        assertThat(slot.compareTo(PracticeKeyFactory.getEndOfDaySlotSk(date))).isNegative();
    }

    @Test
    void isPracticeItem_MatchesOnlyPracticeKeys() {
        assertThat(PracticeKeyFactory.isPracticeItem("PRACTICE#" + ID)).isTrue();
        assertThat(PracticeKeyFactory.isPracticeItem("RULE#" + ID)).isFalse();
        assertThat(PracticeKeyFactory.isPracticeItem(null)).isFalse();
    }

    @Test
    void getSignupSk_PrefixesUserId() {
        assertThat(PracticeKeyFactory.getSignupSk("user_2abc")).isEqualTo("SIGNUP#user_2abc");
        assertThat(PracticeKeyFactory.isSignupItem("SIGNUP#user_2abc")).isTrue();
        assertThat(PracticeKeyFactory.isSignupItem("METADATA")).isFalse();
    }

    @Test
    void getSignupSk_WithBlankUser_ThrowsInvalidKey() {
        assertThatThrownBy(() -> PracticeKeyFactory.getSignupSk(" "))
            .isInstanceOf(InvalidKeyException.class);
    }
}
