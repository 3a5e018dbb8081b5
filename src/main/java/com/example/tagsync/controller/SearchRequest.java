package com.example.tagsync.controller;

import java.util.List;

public record SearchRequest(List<String> trackIds) {}
