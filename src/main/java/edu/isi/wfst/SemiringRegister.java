package edu.isi.wfst;

/**
 * Semirings by name. The built-in semirings are registered when the register
 * is created; others come from plugins named &lt;name&gt;-semiring.jar.
 */
public class SemiringRegister extends GenericRegister<Semiring<?>> {

	private static class Holder {
		static final SemiringRegister INSTANCE = new SemiringRegister();
	}

	public static SemiringRegister getRegister() {
		return Holder.INSTANCE;
	}

	private SemiringRegister() {
		registerBuiltins(this);
	}

	// the semirings every register starts with
	static void registerBuiltins(SemiringRegister register) {
		new GenericRegisterer<Semiring<?>>(register, TropicalSemiring.NAME, new TropicalSemiring());
		new GenericRegisterer<Semiring<?>>(register, LogSemiring.NAME, new LogSemiring());
		new GenericRegisterer<Semiring<?>>(register, RealSemiring.NAME, new RealSemiring());
	}

	protected String convertKeyToPluginFilename(String key) {
		return key.replace('/', '_')+"-semiring.jar";
	}
}
