package se.chronotrust_be.pojo.enums;

public enum DeliveryParty {
    SELLER,     // Confirms the watch was handed over
    BUYER       // Confirms the watch was received
}
