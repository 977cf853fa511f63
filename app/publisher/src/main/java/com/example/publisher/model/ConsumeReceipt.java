package com.example.publisher.model;

public record ConsumeReceipt(CreditSource source, long remaining, String accountId, long amount) {}
