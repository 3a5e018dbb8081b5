package com.example.tagsync.client;

import java.io.IOException;

@FunctionalInterface
public interface ArtworkFetcher {

    byte[] download(String url) throws IOException;
}
