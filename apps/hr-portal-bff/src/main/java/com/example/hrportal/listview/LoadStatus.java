package com.example.hrportal.listview;

public enum LoadStatus {
    IDLE,
    LOADING,
    READY,
    FAILED
}
