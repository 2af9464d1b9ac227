/*
 * Copyright 2023 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sequent.testsupport.domain;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sequent.eventstore.api.Message;

/**
 * Messages of a small shopping cart domain used throughout the tests.
 */
public final class ShoppingCartMessages {
    public static final String PRODUCT_ITEM_ADDED = "ProductItemAdded";
    public static final String PRODUCT_ITEM_REMOVED = "ProductItemRemoved";
    public static final String SHOPPING_CART_CONFIRMED = "ShoppingCartConfirmed";

    private ShoppingCartMessages() {
    }

    public static Message productItemAdded(String productId, int quantity) {
        return Message.event(PRODUCT_ITEM_ADDED, product(productId, quantity));
    }

    public static Message productItemRemoved(String productId, int quantity) {
        return Message.event(PRODUCT_ITEM_REMOVED, product(productId, quantity));
    }

    public static Message shoppingCartConfirmed() {
        return Message.event(SHOPPING_CART_CONFIRMED);
    }

    public static Message confirmShoppingCart() {
        return Message.command("ConfirmShoppingCart", JsonNodeFactory.instance.objectNode());
    }

    private static ObjectNode product(String productId, int quantity) {
        return JsonNodeFactory.instance.objectNode().put("productId", productId).put("quantity", quantity);
    }
}
