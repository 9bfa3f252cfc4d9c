package io.calcrelay.remote;

/**
 * One listed path, relative to the listed folder and always '/'-separated.
 */
public record RemoteEntry(String path, boolean directory, long size) {
}
