package com.assettrack.setracker.protocol.extractor;

/**
 * Remote snapshot payload of an {@code img,5,...} frame. The data is kept
 * exactly as sent; it is not decoded into an image.
 */
public final class SnapshotImage {
    private final String deviceTime;
    private final String imageData;

    public SnapshotImage(String deviceTime, String imageData) {
        this.deviceTime = deviceTime;
        this.imageData = imageData;
    }

    public String getDeviceTime() {
        return deviceTime;
    }

    public String getImageData() {
        return imageData;
    }

    @Override
    public String toString() {
        return "SnapshotImage{deviceTime=" + deviceTime + ", dataLength=" + imageData.length() + '}';
    }
}
