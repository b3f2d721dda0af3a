package edu.isi.wfst;

/**
 * Registers an entry when constructed. Built from startup routines such as
 * {@link SemiringRegister#registerBuiltins} and from plugin
 * {@link RegistrationModule}s:
 *
 * <pre>
 * new GenericRegisterer&lt;Semiring&lt;?&gt;&gt;(SemiringRegister.getRegister(), "mine", new MySemiring());
 * </pre>
 */
public class GenericRegisterer<E> {
	private final String key;

	public GenericRegisterer(GenericRegister<E> register, String key, E entry) {
		this.key = key;
		register.setEntry(key, entry);
	}

	public String getKey() { return key; }
}
