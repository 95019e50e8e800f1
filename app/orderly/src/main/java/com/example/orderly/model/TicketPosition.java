package com.example.orderly.model;

import java.time.Duration;

/** 来訪者向けのステータス照会結果。待ち行列外のチケットは position=0。 */
public record TicketPosition(
    Ticket ticket, long position, long waitingCount, Duration estimatedWait) {}
