package com.bank.patterns.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Copies of the submitted transactions with predicted fields filled in, plus a report")
public record PredictionResult(List<Transaction> transactions, PredictionReport report) {}
