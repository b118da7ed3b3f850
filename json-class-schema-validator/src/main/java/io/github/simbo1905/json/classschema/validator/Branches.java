package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// Runs a subschema on its own stack so its errors can be judged in isolation
final class Branches {
  private Branches() {}

  static List<JsonSchema.ValidationError> run(String path, JsonSchema schema, JsonNode json) {
    Deque<JsonSchema.ValidationFrame> branchStack = new ArrayDeque<>();
    List<JsonSchema.ValidationError> branchErrors = new ArrayList<>();
    branchStack.push(new JsonSchema.ValidationFrame(path, schema, json));
    int steps = 0;
    while (!branchStack.isEmpty()) {
      JsonSchema.ValidationFrame frame = branchStack.pop();
      // self-referencing branches that never consume input would otherwise spin
      if (++steps > 1_000_000) {
        branchErrors.add(new JsonSchema.ValidationError(path, "Validation did not terminate"));
        break;
      }
      JsonSchema.ValidationResult result = frame.schema().validateAt(frame.path(), frame.json(), branchStack);
      if (!result.valid()) {
        branchErrors.addAll(result.errors());
      }
    }
    return branchErrors;
  }
}
