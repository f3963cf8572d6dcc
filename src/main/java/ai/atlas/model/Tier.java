package ai.atlas.model;

public enum Tier {
    FULL("full"),
    SIMPLE("simple");

    private final String suffix;

    Tier(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public static Tier of(boolean fullDetail) {
        return fullDetail ? FULL : SIMPLE;
    }
}
