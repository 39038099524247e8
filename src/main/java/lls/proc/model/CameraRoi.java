package lls.proc.model;

/**
 * Camera region of interest used for an acquisition, in camera pixel coordinates.
 */
public record CameraRoi(int left, int top, int right, int bottom) {

    public int width() {
        return right - left + 1;
    }

    public int height() {
        return bottom - top + 1;
    }
}
