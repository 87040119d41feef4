package fr.tcordel.qtable;

public class TerminalStateException extends IllegalStateException {

	private final transient Object state;

	public TerminalStateException(Object state) {
		super("No legal action from terminal state: " + state);
		this.state = state;
	}

	public Object getState() {
		return state;
	}
}
