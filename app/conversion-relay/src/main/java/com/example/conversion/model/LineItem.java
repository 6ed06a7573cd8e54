package com.example.conversion.model;

public record LineItem(String id, int quantity) {}
