/*
 * どこで: app/user-directory/src/main/java/com/example/userdirectory/api/response/UserResponse.java
 * 何を: GET /users の要素 DTO
 * なぜ: snake_case のフィールド名と null の明示出力を安定した契約として扱うため
 */
package com.example.userdirectory.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"id", "username", "email", "full_name", "created_at", "updated_at"})
public record UserResponse(
    int id,
    String username,
    String email,
    String fullName,
    String createdAt,
    String updatedAt) {
}
