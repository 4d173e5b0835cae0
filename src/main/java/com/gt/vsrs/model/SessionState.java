package com.gt.vsrs.model;

public enum SessionState {
    Idle,
    Active,
    Prompt
}
