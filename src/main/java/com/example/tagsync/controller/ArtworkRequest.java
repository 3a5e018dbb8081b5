package com.example.tagsync.controller;

import java.util.List;

/**
 * Body of POST /api/sync/artwork.
 */
public record ArtworkRequest(List<String> trackIds) {}
