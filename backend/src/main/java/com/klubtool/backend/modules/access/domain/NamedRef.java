package com.klubtool.backend.modules.access.domain;

import java.util.UUID;

public record NamedRef(UUID id, String name) {
}
