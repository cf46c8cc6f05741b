package ai.teliclens.flow;

/** Graph resolutions, from individual variables up to intents. */
public enum ZoomLevel {
    VARIABLE(0),
    FUNCTION(1),
    FILE(2),
    INTENT(3);

    private final int level;

    ZoomLevel(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static ZoomLevel of(int level) {
        for (var zoom : values()) {
            if (zoom.level == level) {
                return zoom;
            }
        }
        throw new IllegalArgumentException("Zoom level must be between 0 and 3, was " + level);
    }

    /** The resolution that suits a viewport of the given width; wider viewports show coarser graphs. */
    public static ZoomLevel forViewBoxWidth(double width) {
        if (width < 1000) {
            return VARIABLE;
        }
        if (width < 2000) {
            return FUNCTION;
        }
        if (width < 4000) {
            return FILE;
        }
        return INTENT;
    }
}
