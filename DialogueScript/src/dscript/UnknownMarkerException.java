package dscript;

/** Thrown by {@link StateMachine#goTo} for a marker the script never declares. */
public class UnknownMarkerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String markerName;

  public UnknownMarkerException(String markerName) {
    super(String.format("no marker named %%%s%% exists in this script", markerName));
    this.markerName = markerName;
  }

  public String markerName() {
    return markerName;
  }
}
