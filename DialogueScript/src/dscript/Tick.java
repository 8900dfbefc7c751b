package dscript;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The commands a {@link StateMachine} emitted on one step. */
@AutoValue
public abstract class Tick {
  /** One-based; a tick after the script ended repeats the last number. */
  public abstract int number();

  public abstract ImmutableList<Command> commands();

  public static Tick of(int number, Command command) {
    return new AutoValue_Tick(number, ImmutableList.of(command));
  }

  public static Tick empty(int number) {
    return new AutoValue_Tick(number, ImmutableList.of());
  }

  public final boolean isEmpty() {
    return commands().isEmpty();
  }

  public final int size() {
    return commands().size();
  }

  public final Command get(int index) {
    return commands().get(index);
  }
}
