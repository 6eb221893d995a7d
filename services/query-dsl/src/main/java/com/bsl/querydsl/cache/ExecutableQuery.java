package com.bsl.querydsl.cache;

import com.fasterxml.jackson.databind.JsonNode;

public interface ExecutableQuery {
    JsonNode execute();
}
