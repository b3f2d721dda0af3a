package edu.isi.wfst;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.TreeSet;

/**
 * Process-wide table from string keys to entries (factories, semirings,
 * descriptors). Each concrete subclass is a singleton and hands itself out
 * through a static getRegister() backed by a holder class, e.g.
 *
 * <pre>
 * public static SemiringRegister getRegister() { return Holder.INSTANCE; }
 * private static class Holder { static final SemiringRegister INSTANCE = new SemiringRegister(); }
 * </pre>
 *
 * The JVM initializes the holder exactly once, so concurrent first callers
 * all see the same fully built register.
 * <p>
 * Entries get in through {@link #setEntry}, usually via a
 * {@link GenericRegisterer}. If plugin loading is turned on, a key that misses
 * is looked for in a jar named by {@link #convertKeyToPluginFilename} inside
 * the plugin directory; the first time a jar is opened, every
 * {@link RegistrationModule} its service file lists is run, and the key is
 * looked up again. Plugin loading is off unless asked for,
 * since it runs whatever code the jar holds.
 *
 * @param <E> the entry type. {@link #emptyEntry()} is returned on a miss
 */
public abstract class GenericRegister<E> {

	private static volatile boolean pluginLoading = false;
	private static volatile File pluginDirectory = new File(".");

	public static void setPluginLoading(boolean b) {
		pluginLoading = b;
	}
	public static boolean isPluginLoading() { return pluginLoading; }

	public static void setPluginDirectory(File dir) {
		pluginDirectory = dir;
	}
	public static File getPluginDirectory() { return pluginDirectory; }

	static final String SERVICE_FILE = "META-INF/services/"+RegistrationModule.class.getName();

	// every plugin jar ever opened. Loaders are kept so their classes stay usable; null marks a jar that failed
	private static final HashMap<File, URLClassLoader> pluginLoaders = new HashMap<File, URLClassLoader>();

	private final Object lock = new Object();
	private final HashMap<String, E> table = new HashMap<String, E>();

	protected GenericRegister() { }

	/** Adds or replaces the entry for key. */
	public void setEntry(String key, E entry) {
		synchronized (lock) {
			table.put(key, entry);
		}
	}

	/**
	 * The entry for key, loading a plugin if needed and allowed. Never throws:
	 * a key nobody registers gets {@link #emptyEntry()} and an error line.
	 */
	public E getEntry(String key) {
		E entry = lookupEntry(key);
		if (entry != null)
			return entry;
		return loadEntryFromPlugin(key);
	}

	// null if key isn't registered
	public E lookupEntry(String key) {
		synchronized (lock) {
			return table.get(key);
		}
	}

	// registered keys, sorted
	public TreeSet<String> getKeys() {
		synchronized (lock) {
			return new TreeSet<String>(table.keySet());
		}
	}

	// what getEntry returns when the key can't be found
	protected E emptyEntry() {
		return null;
	}

	// file name, relative to the plugin directory, of the jar expected to register key
	protected abstract String convertKeyToPluginFilename(String key);

	/**
	 * Opens the plugin jar for key and runs its registration modules. A jar is
	 * opened at most once per process: later misses that map to the same jar
	 * only look the key up again. Only modules listed in the jar's own
	 * META-INF/services file are run, not ones visible through the parent
	 * class loader. Not called under the table lock; the second of two
	 * concurrent misses on the same jar waits for the first to finish loading.
	 */
	protected E loadEntryFromPlugin(String key) {
		if (!pluginLoading) {
			Debug.error(getClass().getSimpleName()+" has no entry for "+key+" and plugin loading is off");
			return emptyEntry();
		}
		File jar = new File(pluginDirectory, convertKeyToPluginFilename(key)).getAbsoluteFile();
		if (!jar.isFile()) {
			Debug.error(getClass().getSimpleName()+" has no entry for "+key+" and no plugin "+jar.getPath());
			return emptyEntry();
		}
		if (!openPlugin(jar))
			return emptyEntry();
		E entry = lookupEntry(key);
		if (entry == null) {
			Debug.error("Lookup of "+key+" failed in plugin "+jar.getPath());
			return emptyEntry();
		}
		return entry;
	}

	// runs the jar's modules the first time it's seen. false if that failed, now or earlier
	private static boolean openPlugin(File jar) {
		boolean debug = false;
		synchronized (pluginLoaders) {
			if (pluginLoaders.containsKey(jar))
				return pluginLoaders.get(jar) != null;
			if (debug) Debug.debug(debug, "Opening plugin "+jar.getPath());
			URLClassLoader loader = null;
			try {
				loader = new URLClassLoader(new URL[] { jar.toURI().toURL() }, GenericRegister.class.getClassLoader());
				int modules = runModules(loader);
				if (debug) Debug.debug(debug, "Ran "+modules+" modules from "+jar.getPath());
				pluginLoaders.put(jar, loader);
				return true;
			}
			catch (IOException e) {
				Debug.error("Couldn't read plugin "+jar.getPath()+": "+e.getMessage());
			}
			catch (ReflectiveOperationException e) {
				Debug.error("Couldn't create registration module from "+jar.getPath()+": "+e);
			}
			catch (RuntimeException e) {
				Debug.error("Registration module in "+jar.getPath()+" failed: "+e);
			}
			catch (LinkageError e) {
				Debug.error("Couldn't link registration module in "+jar.getPath()+": "+e);
			}
			// remember the failure so the jar isn't opened again
			pluginLoaders.put(jar, null);
			if (loader != null)
				closeQuietly(loader, jar);
			return false;
		}
	}

	// instantiates and runs each module named in the jar's own service file
	private static int runModules(URLClassLoader loader) throws IOException, ReflectiveOperationException {
		int modules = 0;
		// findResources only searches the jar, never the parent loader
		Enumeration<URL> files = loader.findResources(SERVICE_FILE);
		while (files.hasMoreElements()) {
			URL url = files.nextElement();
			BufferedReader br = new BufferedReader(new InputStreamReader(url.openStream(), StandardCharsets.UTF_8));
			try {
				String line;
				while ((line = br.readLine()) != null) {
					int comment = line.indexOf('#');
					if (comment >= 0)
						line = line.substring(0, comment);
					line = line.trim();
					if (line.length() == 0)
						continue;
					Class<? extends RegistrationModule> cls =
						Class.forName(line, true, loader).asSubclass(RegistrationModule.class);
					cls.getConstructor().newInstance().register();
					modules++;
				}
			}
			finally {
				br.close();
			}
		}
		return modules;
	}

	private static void closeQuietly(URLClassLoader loader, File jar) {
		try {
			loader.close();
		}
		catch (IOException e) {
			Debug.error("Couldn't close plugin "+jar.getPath()+": "+e.getMessage());
		}
	}
}
