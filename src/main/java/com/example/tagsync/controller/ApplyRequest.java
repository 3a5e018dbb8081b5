package com.example.tagsync.controller;

import com.example.tagsync.model.TrackSelection;

import java.util.List;

public record ApplyRequest(List<TrackSelection> selections) {}
