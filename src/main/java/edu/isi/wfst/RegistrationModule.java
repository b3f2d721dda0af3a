package edu.isi.wfst;

/**
 * A unit of registrations shipped in a plugin jar. The jar lists its modules
 * in META-INF/services/edu.isi.wfst.RegistrationModule, one class name per
 * line, with # comments. The first time a register opens the jar, each module
 * is created through its public no-argument constructor and its register() is
 * run once; it is expected to add the entries the jar provides.
 */
public interface RegistrationModule {
	public void register();
}
