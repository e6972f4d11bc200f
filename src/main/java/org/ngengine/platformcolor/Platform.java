package org.ngengine.platformcolor;

/** Live-dashboard platforms the classifier can tell apart. */
public enum Platform {
    TIKTOK("tiktok"),
    SHOPEE("shopee");

    private final String id;

    Platform(String id) {
        this.id = id;
    }

    /** Lower-case identifier used by downstream OCR routing. */
    public String id() {
        return id;
    }
}
