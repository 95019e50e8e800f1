/*
 * どこで: Orderly ドメインモデル
 * 何を: チケットのライフサイクル状態と許可遷移を定義する
 * なぜ: 状態遷移ルールを 1 か所に固定し、逆戻りや終端からの遷移を防ぐため
 */
package com.example.orderly.model;

public enum TicketState {
  WAITING,
  CALLED,
  SERVED,
  CANCELLED;

  public boolean isTerminal() {
    return this == SERVED || this == CANCELLED;
  }

  /**
   * 役割: this から next への遷移が許可されているかを判定する。
   * 動作: WAITING→CALLED/CANCELLED、CALLED→SERVED/CANCELLED のみ true を返す。
   * 前提: next は null でないこと。
   */
  public boolean canTransitionTo(TicketState next) {
    return switch (this) {
      case WAITING -> next == CALLED || next == CANCELLED;
      case CALLED -> next == SERVED || next == CANCELLED;
      case SERVED, CANCELLED -> false;
    };
  }

  public static TicketState fromValue(String value) {
    for (TicketState state : values()) {
      if (state.name().equalsIgnoreCase(value)) {
        return state;
      }
    }
    throw new IllegalArgumentException("unsupported ticket state: " + value);
  }
}
