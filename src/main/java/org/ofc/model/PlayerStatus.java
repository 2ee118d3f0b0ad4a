package org.ofc.model;

public enum PlayerStatus { ACTIVE, FOULED, FANTASY_LAND, ELIMINATED }
