package fr.tcordel.qtable;

public class UnknownStateException extends IllegalArgumentException {

	private final transient Object state;

	public UnknownStateException(Object state) {
		super("Unknown state: " + state);
		this.state = state;
	}

	public Object getState() {
		return state;
	}
}
