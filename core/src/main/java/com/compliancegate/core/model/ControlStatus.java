package com.compliancegate.core.model;

public enum ControlStatus { PASS, FAIL }
