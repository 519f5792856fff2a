package com.zonewatch.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.zonewatch.entity.AlertSettings;
import org.junit.jupiter.api.Test;

class InMemorySettingsRepositoryTest {

    @Test
    void save_merges_only_non_null_fields() {
        AlertSettings seed = new AlertSettings();
        seed.setTelegramEnabled(true);
        seed.setTelegramBotToken("secret");
        seed.setSyncSchedule("0 * * * *");
        InMemorySettingsRepository repo = new InMemorySettingsRepository(seed);

        AlertSettings patch = new AlertSettings();
        patch.setSyncSchedule("*/30 * * * *");
        patch.setNotifyOnAdd(false);
        AlertSettings saved = repo.save(patch);

        assertThat(saved.getSyncSchedule()).isEqualTo("*/30 * * * *");
        assertThat(saved.getTelegramBotToken()).isEqualTo("secret");
        assertThat(saved.isTelegramOn()).isTrue();
        assertThat(saved.getNotifyOnAdd()).isFalse();
    }

    @Test
    void get_returns_an_independent_copy() {
        InMemorySettingsRepository repo = new InMemorySettingsRepository(new AlertSettings());
        repo.get().setTelegramEnabled(true);
        assertThat(repo.get().isTelegramOn()).isFalse();
    }

    @Test
    void secrets_are_left_out_of_to_string() {
        AlertSettings s = new AlertSettings();
        s.setTelegramBotToken("123:abc");
        s.setWebhookPassword("hunter2");
        assertThat(s.toString()).doesNotContain("123:abc").doesNotContain("hunter2");
    }
}
