package com.klubtool.backend.modules.committee.presentation.dto;

import java.util.UUID;

public record SubstituteResponse(
        UUID memberId,
        String memberName,
        UUID substituteMemberId,
        String substituteName
) {
}
