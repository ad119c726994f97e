package com.github.fsmcompiler;

/**
 * Editor layout of one state node. The compiler only prints it into the metadata preamble of a
 * saved file; reading it back is up to the editor.
 */
public final class NodeLayout {
  static final NodeLayout DEFAULT = new NodeLayout(0, 0, 1, 1);

  private final double x;
  private final double y;
  private final int inPortCount;
  private final int outPortCount;

  public NodeLayout(final double x, final double y, final int inPortCount,
      final int outPortCount) {
    this.x = x;
    this.y = y;
    this.inPortCount = inPortCount;
    this.outPortCount = outPortCount;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public int getInPortCount() {
    return inPortCount;
  }

  public int getOutPortCount() {
    return outPortCount;
  }

  /**
   * Renders {@code #name;x;y;inPortCount;outPortCount}. Whole-number coordinates are printed
   * without a fraction.
   */
  String toPreambleLine(final String stateName) {
    return "#" + stateName + ";" + formatCoordinate(x) + ";" + formatCoordinate(y) + ";"
        + inPortCount + ";" + outPortCount;
  }

  private static String formatCoordinate(final double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)
        && Math.abs(value) < Long.MAX_VALUE) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  @Override
  public String toString() {
    return "NodeLayout [x=" + x + ", y=" + y + ", inPortCount=" + inPortCount
        + ", outPortCount=" + outPortCount + "]";
  }
}
