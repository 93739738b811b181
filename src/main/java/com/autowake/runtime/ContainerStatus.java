package com.autowake.runtime;

public enum ContainerStatus { RUNNING, STOPPED, UNKNOWN }
