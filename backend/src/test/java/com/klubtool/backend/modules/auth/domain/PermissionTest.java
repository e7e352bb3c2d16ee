package com.klubtool.backend.modules.auth.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class PermissionTest {

    @Test
    void codesAreDomainDotAction() {
        assertThat(Permission.MOTION_VOTE.code()).isEqualTo("motion.vote");
        assertThat(Arrays.stream(Permission.values()).map(Permission::code).distinct().count())
                .isEqualTo(Permission.values().length);
    }

    @Test
    void lookupIsCaseInsensitiveAndTrimmed() {
        assertThat(Permission.fromCode(" GROUP.Edit ")).contains(Permission.GROUP_EDIT);
        assertThat(Permission.fromCode("group.fly")).isEmpty();
        assertThat(Permission.fromCode(null)).isEmpty();
        assertThat(Permission.of("committee", "view")).contains(Permission.COMMITTEE_VIEW);
    }

    @Test
    void parseKnownSkipsUnknownCodes() {
        assertThat(Permission.parseKnown(List.of("user.view", "retired.permission")))
                .containsExactly(Permission.USER_VIEW);
        assertThat(Permission.parseKnown(null)).isEmpty();
    }
}
