package com.autowake.core.registry;

/**
 * Administrative intent for a service. {@link #ON} pins a service so the idle monitor leaves it alone.
 */
public enum DesiredState { ON, OFF }
