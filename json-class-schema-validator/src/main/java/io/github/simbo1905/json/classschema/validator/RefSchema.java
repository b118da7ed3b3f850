package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// Reference schema for JSON Schema $ref
public record RefSchema(RefToken refToken, ResolverContext resolverContext) implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    LOG.finest(() -> "RefSchema.validateAt: " + refToken.pointer() + " at path: " + path);
    JsonSchema target = resolverContext.resolve(refToken);
    // Stay on the SAME traversal stack (uniform non-recursive execution).
    stack.push(new ValidationFrame(path, target, json));
    return ValidationResult.success();
  }

  @Override
  public String toString() {
    return "RefSchema[" + refToken.pointer() + "]";
  }
}
