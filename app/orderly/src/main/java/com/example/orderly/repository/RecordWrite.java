package com.example.orderly.repository;

/** commit に渡す 1 件分の書き込み。DELETE の payload は常に null。 */
public record RecordWrite(String key, Operation operation, String payload, WriteCondition condition) {

  public enum Operation {
    PUT,
    DELETE
  }

  public RecordWrite {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key is required");
    }
    if (operation == null) {
      throw new IllegalArgumentException("operation is required");
    }
    if (operation == Operation.PUT && payload == null) {
      throw new IllegalArgumentException("payload is required for put: " + key);
    }
    if (condition == null) {
      throw new IllegalArgumentException("condition is required");
    }
  }

  public static RecordWrite put(String key, String payload, WriteCondition condition) {
    return new RecordWrite(key, Operation.PUT, payload, condition);
  }

  public static RecordWrite delete(String key, WriteCondition condition) {
    return new RecordWrite(key, Operation.DELETE, null, condition);
  }
}
